package com.example.demo.deckgen.style;

import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.remote.Dimension;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.ParagraphStyle;
import com.example.demo.deckgen.remote.Placeholder;
import com.example.demo.deckgen.remote.TextElement;
import com.example.demo.deckgen.remote.TextStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Computes the style a placeholder shape renders with by walking its placeholder
 * parents (slide, layout, master) and overlaying their text styles.
 */
@Slf4j
@Component
public class StyleInheritanceResolver {

    /**
     * Slide -> layout -> master needs two lookups; the third is headroom.
     */
    public static final int MAX_PARENT_DEPTH = 3;

    /**
     * Inheritance chain of an element, oldest ancestor first and the element itself last.
     * A cycle or a chain deeper than {@link #MAX_PARENT_DEPTH} is cut off with a warning.
     */
    public List<PageElement> ancestorChain(PageElement element, DocumentSnapshot snapshot) {
        if (element == null) {
            return Collections.emptyList();
        }
        LinkedList<PageElement> chain = new LinkedList<>();
        Set<String> visited = new HashSet<>();
        chain.addFirst(element);
        visited.add(element.getObjectId());

        PageElement current = element;
        int lookups = 0;
        while (true) {
            Placeholder placeholder = current.placeholder();
            if (placeholder == null || placeholder.getParentObjectId() == null) {
                break;
            }
            String parentId = placeholder.getParentObjectId();
            if (visited.contains(parentId)) {
                log.warn("Placeholder inheritance cycle at {} (from {}), using the chain collected so far",
                        parentId, element.getObjectId());
                break;
            }
            if (lookups >= MAX_PARENT_DEPTH) {
                log.warn("Placeholder inheritance of {} deeper than {} levels, truncating",
                        element.getObjectId(), MAX_PARENT_DEPTH);
                break;
            }
            PageElement parent = snapshot.findElement(parentId);
            if (parent == null) {
                log.debug("Parent {} of {} not in snapshot", parentId, current.getObjectId());
                break;
            }
            lookups++;
            visited.add(parentId);
            chain.addFirst(parent);
            current = parent;
        }
        return new ArrayList<>(chain);
    }

    public EffectiveStyle resolve(PageElement element, DocumentSnapshot snapshot) {
        return resolve(ancestorChain(element, snapshot));
    }

    /**
     * Overlays the chain, oldest first, on top of {@link EffectiveStyle#defaults()}.
     */
    public EffectiveStyle resolve(List<PageElement> chain) {
        EffectiveStyle style = EffectiveStyle.defaults();
        for (PageElement element : chain) {
            List<TextElement> textElements = textElements(element);
            overlayParagraph(style, firstParagraphStyle(textElements));
            overlayText(style, firstTextStyle(textElements));
        }
        return style;
    }

    private static void overlayParagraph(EffectiveStyle style, ParagraphStyle paragraph) {
        if (paragraph == null) {
            return;
        }
        if (paragraph.getLineSpacing() != null) {
            style.setLineSpacing(paragraph.getLineSpacing());
        }
        if (paragraph.getAlignment() != null) {
            style.setAlignment(paragraph.getAlignment());
        }
        if (paragraph.getDirection() != null) {
            style.setDirection(paragraph.getDirection());
        }
        if (paragraph.getSpacingMode() != null) {
            style.setSpacingMode(paragraph.getSpacingMode());
        }
        if (hasMagnitude(paragraph.getIndentStart())) {
            style.setIndentStart(paragraph.getIndentStart().toPoints());
        }
        if (hasMagnitude(paragraph.getIndentEnd())) {
            style.setIndentEnd(paragraph.getIndentEnd().toPoints());
        }
        if (hasMagnitude(paragraph.getIndentFirstLine())) {
            style.setIndentFirstLine(paragraph.getIndentFirstLine().toPoints());
        }
        if (hasMagnitude(paragraph.getSpaceAbove())) {
            style.setSpaceAbove(paragraph.getSpaceAbove().toPoints());
        }
        if (hasMagnitude(paragraph.getSpaceBelow())) {
            style.setSpaceBelow(paragraph.getSpaceBelow().toPoints());
        }
    }

    private static void overlayText(EffectiveStyle style, TextStyle text) {
        if (text == null) {
            return;
        }
        if (text.getFontFamily() != null) {
            style.setFontFamily(text.getFontFamily());
        }
        if (hasMagnitude(text.getFontSize())) {
            style.setFontSize(text.getFontSize().toPoints());
        }
        if (text.getWeightedFontFamily() != null) {
            if (text.getWeightedFontFamily().getFontFamily() != null) {
                style.setFontFamily(text.getWeightedFontFamily().getFontFamily());
            }
            if (text.getWeightedFontFamily().getWeight() != null) {
                style.setWeight(text.getWeightedFontFamily().getWeight());
            }
        }
    }

    private static List<TextElement> textElements(PageElement element) {
        if (element.getShape() == null || element.getShape().getText() == null
                || element.getShape().getText().getTextElements() == null) {
            return Collections.emptyList();
        }
        return element.getShape().getText().getTextElements();
    }

    private static ParagraphStyle firstParagraphStyle(List<TextElement> elements) {
        for (TextElement element : elements) {
            if (element.getParagraphMarker() != null) {
                return element.getParagraphMarker().getStyle();
            }
        }
        return null;
    }

    private static TextStyle firstTextStyle(List<TextElement> elements) {
        for (TextElement element : elements) {
            if (element.getTextRun() != null) {
                return element.getTextRun().getStyle();
            }
        }
        return null;
    }

    private static boolean hasMagnitude(Dimension dimension) {
        return dimension != null && dimension.getMagnitude() != null;
    }
}
