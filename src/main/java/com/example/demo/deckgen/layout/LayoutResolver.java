package com.example.demo.deckgen.layout;

import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.exception.LayoutNotFoundException;
import com.example.demo.deckgen.model.SlideDefinition;
import com.example.demo.deckgen.model.TextDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the predefined layout a slide is created from.
 */
@Slf4j
@Component
public class LayoutResolver {

    public static final String TITLE = "TITLE";
    public static final String SECTION_HEADER = "SECTION_HEADER";
    public static final String TITLE_AND_BODY = "TITLE_AND_BODY";
    public static final String TITLE_AND_TWO_COLUMNS = "TITLE_AND_TWO_COLUMNS";
    public static final String BLANK = "BLANK";

    /**
     * Layout name for the slide: its explicit layout when set, otherwise derived from
     * the content it carries.
     */
    public String layoutNameFor(SlideDefinition slide) {
        if (slide.getCustomLayout() != null && !slide.getCustomLayout().isBlank()) {
            return slide.getCustomLayout();
        }
        boolean hasTitle = hasText(slide.getTitle());
        boolean hasSubtitle = hasText(slide.getSubtitle());
        int bodies = slide.getBodies() == null ? 0 : slide.getBodies().size();
        boolean hasContent = bodies > 0 || slide.hasTables();

        if (hasTitle && hasSubtitle && !hasContent) {
            return TITLE;
        }
        if (hasTitle && !hasContent) {
            return SECTION_HEADER;
        }
        if (bodies >= 2) {
            return TITLE_AND_TWO_COLUMNS;
        }
        if (hasContent) {
            return TITLE_AND_BODY;
        }
        return BLANK;
    }

    /**
     * Object id of the slide's layout in the given snapshot.
     *
     * @throws LayoutNotFoundException if the presentation has no layout of that name
     */
    public String resolveLayoutId(SlideDefinition slide, DocumentSnapshot snapshot) {
        String name = layoutNameFor(slide);
        String layoutId = snapshot.findLayoutIdByName(name)
                .orElseThrow(() -> new LayoutNotFoundException(name));
        log.debug("Slide #{} uses layout {} ({})", slide.getIndex(), name, layoutId);
        return layoutId;
    }

    private static boolean hasText(TextDefinition text) {
        return text != null && text.getRawText() != null && !text.getRawText().isEmpty();
    }
}
