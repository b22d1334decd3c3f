package com.example.demo.deckgen.autofit;

import lombok.Value;

/**
 * Memo key of one autofit computation.
 */
@Value
public class FontSizeKey {
    String text;
    String elementId;
    FitConstraint constraint;
}
