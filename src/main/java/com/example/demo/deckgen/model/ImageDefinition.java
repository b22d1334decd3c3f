package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An image to place on a slide. Dimensions, padding and offsets are in pixels.
 * The url may point to a local file ({@code file:}) until the upload step
 * rewrites it to a public address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageDefinition {
    private String url;
    private double width;
    private double height;
    private double padding;
    private double offsetX;
    private double offsetY;
    private String altText;
}
