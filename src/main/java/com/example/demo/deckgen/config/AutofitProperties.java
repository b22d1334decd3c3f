package com.example.demo.deckgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for the autofit font sizing.
 *
 * deckgen:
 *   autofit:
 *     min-font-size: 14
 *     step: 0.25
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "deckgen.autofit")
public class AutofitProperties {

    /**
     * Smallest size (pt) the search will shrink to. Anything smaller is not readable on a projector.
     */
    private double minFontSize = 14;

    /**
     * Decrement (pt) applied on each iteration of the search.
     */
    private double step = 0.25;

    /**
     * Size (pt) used when neither the text runs nor the inherited style name one.
     */
    private double defaultFontSize = 16;

    /**
     * Space (pt) lost to the shape's inner padding, subtracted from both box dimensions.
     */
    private double padding = 0.2 * 72;

    /**
     * Measured glyph widths run narrower than the remote renderer lays them out.
     */
    private double widthCorrection = 1.15;

    /**
     * Number of leading characters measured to estimate the average character width.
     */
    private int sampleSize = 100;

    /**
     * Maximum entries of the per-run memo cache.
     */
    private long cacheMaximumSize = 10_000;
}
