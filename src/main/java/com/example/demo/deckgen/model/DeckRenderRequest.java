package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to render a parsed deck into a remote presentation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeckRenderRequest {
    /**
     * Target presentation. When null a new presentation named {@link #title} is created.
     */
    private String presentationId;

    /**
     * Presentation to copy and render into instead. Its layouts decide where content goes.
     */
    private String templateId;

    /**
     * Name of a created presentation or template copy.
     */
    private String title;

    @Builder.Default
    private List<SlideDefinition> slides = new ArrayList<>();

    /**
     * Resolved stylesheet from the parser. Only used by the host, carried through untouched.
     */
    private String stylesheet;

    /**
     * Allow local images to be uploaded to the temporary hosting service.
     */
    private boolean allowUpload;

    /**
     * Delete the slides the presentation already has before adding new ones.
     */
    private boolean eraseExisting;
}
