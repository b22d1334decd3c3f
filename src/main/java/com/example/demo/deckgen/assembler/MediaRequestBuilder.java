package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.geometry.Placement;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.VideoDefinition;
import com.example.demo.deckgen.remote.AffineTransform;
import com.example.demo.deckgen.remote.Dimension;
import com.example.demo.deckgen.remote.Size;
import com.example.demo.deckgen.remote.request.CreateImageRequest;
import com.example.demo.deckgen.remote.request.CreateVideoRequest;
import com.example.demo.deckgen.remote.request.PageElementProperties;
import com.example.demo.deckgen.remote.request.Request;
import com.example.demo.deckgen.remote.request.UpdatePageElementAltTextRequest;
import com.example.demo.deckgen.remote.request.UpdatePagePropertiesRequest;
import com.example.demo.deckgen.remote.request.UpdatePagePropertiesRequest.PageBackgroundFill;
import com.example.demo.deckgen.remote.request.UpdatePagePropertiesRequest.PageProperties;
import com.example.demo.deckgen.remote.request.UpdatePagePropertiesRequest.StretchedPictureFill;
import com.example.demo.deckgen.remote.request.UpdateVideoPropertiesRequest;
import com.example.demo.deckgen.remote.request.UpdateVideoPropertiesRequest.VideoProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
public class MediaRequestBuilder {

    static final String VIDEO_SOURCE = "YOUTUBE";

    public Request background(ImageDefinition image, String slideObjectId) {
        return Request.of(UpdatePagePropertiesRequest.builder()
                .objectId(slideObjectId)
                .pageProperties(new PageProperties(new PageBackgroundFill(new StretchedPictureFill(image.getUrl()))))
                .fields("pageBackgroundFill.stretchedPictureFill.contentUrl")
                .build());
    }

    /**
     * A createImage request followed by its alt text update, per image.
     */
    public List<Request> images(List<ImageDefinition> images, List<Placement> placements, String slideObjectId) {
        if (images.size() != placements.size()) {
            throw new IllegalArgumentException(images.size() + " images but " + placements.size() + " placements");
        }
        List<Request> requests = new ArrayList<>(images.size() * 2);
        for (int i = 0; i < images.size(); i++) {
            ImageDefinition image = images.get(i);
            String imageId = UUID.randomUUID().toString();
            requests.add(Request.of(CreateImageRequest.builder()
                    .objectId(imageId)
                    .url(image.getUrl())
                    .elementProperties(elementProperties(slideObjectId, placements.get(i)))
                    .build()));
            requests.add(Request.of(UpdatePageElementAltTextRequest.builder()
                    .objectId(imageId)
                    .title("")
                    .description(image.getAltText() == null ? "" : image.getAltText())
                    .build()));
        }
        return requests;
    }

    public List<Request> video(VideoDefinition video, Placement placement, String slideObjectId) {
        String videoId = UUID.randomUUID().toString();
        List<Request> requests = new ArrayList<>(2);
        requests.add(Request.of(CreateVideoRequest.builder()
                .objectId(videoId)
                .source(VIDEO_SOURCE)
                .id(video.getId())
                .elementProperties(elementProperties(slideObjectId, placement))
                .build()));
        requests.add(Request.of(UpdateVideoPropertiesRequest.builder()
                .objectId(videoId)
                .videoProperties(new VideoProperties(video.isAutoPlay()))
                .fields("autoPlay")
                .build()));
        return requests;
    }

    private static PageElementProperties elementProperties(String slideObjectId, Placement placement) {
        return PageElementProperties.builder()
                .pageObjectId(slideObjectId)
                .size(new Size(Dimension.emu(placement.getWidth()), Dimension.emu(placement.getHeight())))
                .transform(AffineTransform.translation(placement.getTranslateX(), placement.getTranslateY()))
                .build();
    }
}
