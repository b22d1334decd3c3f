package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.geometry.Placement;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.VideoDefinition;
import com.example.demo.deckgen.remote.request.CreateImageRequest;
import com.example.demo.deckgen.remote.request.Request;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MediaRequestBuilderTest {

    private final MediaRequestBuilder builder = new MediaRequestBuilder();

    @Test
    public void testBackground() {
        Request request = builder.background(ImageDefinition.builder().url("https://img/bg.png").build(), "slide1");

        assertEquals("slide1", request.getUpdatePageProperties().getObjectId());
        assertEquals("https://img/bg.png", request.getUpdatePageProperties().getPageProperties()
                .getPageBackgroundFill().getStretchedPictureFill().getContentUrl());
        assertEquals("pageBackgroundFill.stretchedPictureFill.contentUrl", request.getUpdatePageProperties().getFields());
    }

    @Test
    public void testImagesGetAltText() {
        List<ImageDefinition> images = List.of(
                ImageDefinition.builder().url("https://img/a.png").altText("A chart").build(),
                ImageDefinition.builder().url("https://img/b.png").build());
        List<Placement> placements = List.of(new Placement(10, 20, 300, 200), new Placement(310, 20, 100, 100));

        List<Request> requests = builder.images(images, placements, "slide1");

        assertEquals(4, requests.size());
        CreateImageRequest first = requests.get(0).getCreateImage();
        assertEquals("https://img/a.png", first.getUrl());
        assertEquals(300.0, first.getElementProperties().getSize().getWidth().getMagnitude());
        assertEquals("EMU", first.getElementProperties().getSize().getWidth().getUnit());
        assertEquals(10.0, first.getElementProperties().getTransform().getTranslateX());
        assertEquals(first.getObjectId(), requests.get(1).getUpdatePageElementAltText().getObjectId());
        assertEquals("A chart", requests.get(1).getUpdatePageElementAltText().getDescription());
        assertEquals("", requests.get(3).getUpdatePageElementAltText().getDescription());
        assertNotEquals(first.getObjectId(), requests.get(2).getCreateImage().getObjectId());
    }

    @Test
    public void testPlacementCountMustMatch() {
        assertThrows(IllegalArgumentException.class, () -> builder.images(
                List.of(ImageDefinition.builder().url("u").build()), List.of(), "slide1"));
    }

    @Test
    public void testVideo() {
        VideoDefinition video = VideoDefinition.builder().id("dQw4w9WgXcQ").width(16).height(9).autoPlay(true).build();

        List<Request> requests = builder.video(video, new Placement(0, 0, 1600, 900), "slide1");

        assertEquals(Request.CREATE_VIDEO, requests.get(0).kind());
        assertEquals("YOUTUBE", requests.get(0).getCreateVideo().getSource());
        assertEquals("dQw4w9WgXcQ", requests.get(0).getCreateVideo().getId());
        assertTrue(requests.get(1).getUpdateVideoProperties().getVideoProperties().getAutoPlay());
        assertEquals("autoPlay", requests.get(1).getUpdateVideoProperties().getFields());
    }
}
