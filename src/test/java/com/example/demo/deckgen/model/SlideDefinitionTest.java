package com.example.demo.deckgen.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Slide Definition Tests")
public class SlideDefinitionTest {

    @Test
    @DisplayName("A slide moves from pending to created to populated")
    public void testLifecycle() {
        SlideDefinition slide = SlideDefinition.builder().index(3).build();
        assertEquals(SlideState.PENDING, slide.getState());
        assertNull(slide.getObjectId());

        slide.markCreated("slide_3");
        assertEquals(SlideState.CREATED, slide.getState());
        assertEquals("slide_3", slide.getObjectId());

        slide.markPopulated();
        assertEquals(SlideState.POPULATED, slide.getState());
    }

    @Test
    public void testTransitionsCannotBeSkippedOrRepeated() {
        SlideDefinition pending = SlideDefinition.builder().index(0).build();
        assertThrows(IllegalStateException.class, pending::markPopulated);

        pending.markCreated("s0");
        assertThrows(IllegalStateException.class, () -> pending.markCreated("again"));
    }

    @Test
    public void testAllImagesListsBackgroundFirst() {
        ImageDefinition background = ImageDefinition.builder().url("bg").build();
        ImageDefinition first = ImageDefinition.builder().url("one").build();
        ImageDefinition second = ImageDefinition.builder().url("two").build();
        SlideDefinition slide = SlideDefinition.builder()
                .backgroundImage(background)
                .bodies(List.of(
                        Body.builder().images(List.of(first)).build(),
                        Body.builder().images(List.of(second)).build()))
                .build();

        assertEquals(List.of(background, first, second), slide.allImages());
        assertTrue(slide.hasBodies());
        assertFalse(slide.hasTables());
    }
}
