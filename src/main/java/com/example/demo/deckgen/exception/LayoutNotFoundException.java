package com.example.demo.deckgen.exception;

/**
 * Raised when a slide asks for a layout the presentation does not define.
 * Fatal for the whole run.
 */
public class LayoutNotFoundException extends DeckGenerationException {
    private final String layoutName;

    public LayoutNotFoundException(String layoutName) {
        super("LAYOUT_NOT_FOUND", "Unable to find layout " + layoutName);
        this.layoutName = layoutName;
    }

    public String getLayoutName() {
        return layoutName;
    }
}
