package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Character style override over {@code [start, end)}. Null fields are not overridden.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TextRun {
    private int start;
    private int end;

    private Boolean bold;
    private Boolean italic;
    private Boolean underline;
    private Boolean strikethrough;
    private Boolean smallCaps;
    private String fontFamily;

    /**
     * Font size in points
     */
    private Double fontSize;

    /**
     * Hex colors, e.g. "#ff0000"
     */
    private String foregroundColor;
    private String backgroundColor;

    private String link;

    /**
     * SUPERSCRIPT, SUBSCRIPT or NONE
     */
    private String baselineOffset;
}
