package com.example.demo.deckgen.style;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Style an element renders with once every inherited layer is applied.
 * Lengths are in points.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EffectiveStyle {
    @Builder.Default
    private String fontFamily = "Arial";

    @Builder.Default
    private double fontSize = 16;

    @Builder.Default
    private int weight = 400;

    /**
     * Percentage of normal line height
     */
    @Builder.Default
    private double lineSpacing = 115;

    @Builder.Default
    private String alignment = "START";

    @Builder.Default
    private String direction = "LEFT_TO_RIGHT";

    @Builder.Default
    private String spacingMode = "NEVER_COLLAPSE";

    private double indentStart;
    private double indentEnd;
    private double indentFirstLine;
    private double spaceAbove;
    private double spaceBelow;

    public static EffectiveStyle defaults() {
        return EffectiveStyle.builder().build();
    }
}
