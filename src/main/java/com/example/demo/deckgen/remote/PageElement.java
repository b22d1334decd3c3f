package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Element on a page. Exactly one of the content fields (shape, image, ...) is set;
 * only shapes and images matter here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageElement {
    private String objectId;
    private Size size;
    private AffineTransform transform;
    private Shape shape;
    private ImageElement image;
    private String title;
    private String description;

    /**
     * Placeholder info of a shape or image, or null when the element is not a placeholder.
     */
    @JsonIgnore
    public Placeholder placeholder() {
        if (shape != null && shape.getPlaceholder() != null) {
            return shape.getPlaceholder();
        }
        if (image != null) {
            return image.getPlaceholder();
        }
        return null;
    }
}
