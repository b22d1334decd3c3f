package com.example.demo.deckgen.autofit;

/**
 * Measures rendered text. Sizes go in as points, widths come out in pixels.
 */
public interface TextMeasurer {

    /**
     * Advance width of a single line of text, in pixels.
     */
    double measureWidth(String text, String fontFamily, double weight, double fontSizePt);

    /**
     * Height of one line box, in pixels.
     */
    double lineHeight(String fontFamily, double weight, double fontSizePt);
}
