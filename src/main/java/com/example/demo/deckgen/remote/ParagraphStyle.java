package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParagraphStyle {
    /**
     * Percentage of normal line height, 100 = single spaced
     */
    private Double lineSpacing;
    private String alignment;
    private Dimension indentStart;
    private Dimension indentEnd;
    private Dimension indentFirstLine;
    private Dimension spaceAbove;
    private Dimension spaceBelow;
    private String direction;
    private String spacingMode;
}
