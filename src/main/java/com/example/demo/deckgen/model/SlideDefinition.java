package com.example.demo.deckgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One slide of the deck as produced by the parser. The assembler assigns
 * {@link #objectId} during the create pass and advances {@link #state}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlideDefinition {
    private int index;

    /**
     * Explicit layout name, overriding the content based choice.
     */
    private String customLayout;

    private TextDefinition title;
    private TextDefinition subtitle;

    @Builder.Default
    private List<Body> bodies = new ArrayList<>();

    private ImageDefinition backgroundImage;

    @Builder.Default
    private List<TableDefinition> tables = new ArrayList<>();

    /**
     * Speaker notes
     */
    private TextDefinition notes;

    /**
     * Remote object id, absent until the create pass. Both it and {@link #state}
     * are output only.
     */
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String objectId;

    @Builder.Default
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private SlideState state = SlideState.PENDING;

    public void markCreated(String assignedObjectId) {
        if (state != SlideState.PENDING) {
            throw new IllegalStateException("Slide #" + index + " cannot be created from state " + state);
        }
        this.objectId = assignedObjectId;
        this.state = SlideState.CREATED;
    }

    public void markPopulated() {
        if (state != SlideState.CREATED || objectId == null) {
            throw new IllegalStateException("Slide #" + index + " cannot be populated from state " + state);
        }
        this.state = SlideState.POPULATED;
    }

    @JsonIgnore
    public boolean hasBodies() {
        return bodies != null && !bodies.isEmpty();
    }

    @JsonIgnore
    public boolean hasTables() {
        return tables != null && !tables.isEmpty();
    }

    /**
     * All images of the slide, background first, in document order.
     */
    @JsonIgnore
    public List<ImageDefinition> allImages() {
        List<ImageDefinition> images = new ArrayList<>();
        if (backgroundImage != null) {
            images.add(backgroundImage);
        }
        if (bodies != null) {
            for (Body body : bodies) {
                if (body.getImages() != null) {
                    images.addAll(body.getImages());
                }
            }
        }
        return images;
    }
}
