package com.example.demo.deckgen.core;

import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.remote.Page;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.Placeholder;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over one fetch of the remote presentation.
 *
 * Object ids of placeholders are only meaningful for the read they came from:
 * once any batch has been applied the snapshot is stale and a fresh one has to
 * be fetched. The element index spans slides, masters and layouts so parent
 * lookups during style inheritance are O(1).
 */
public class DocumentSnapshot {
    private final Presentation presentation;
    private final Map<String, PageElement> elementIndex = new HashMap<>();
    private final Map<String, Page> slideIndex = new LinkedHashMap<>();

    public DocumentSnapshot(Presentation presentation) {
        if (presentation == null) {
            throw new IllegalArgumentException("presentation must not be null");
        }
        this.presentation = presentation;
        indexPages(presentation.getSlides());
        indexPages(presentation.getMasters());
        indexPages(presentation.getLayouts());
        if (presentation.getSlides() != null) {
            for (Page slide : presentation.getSlides()) {
                slideIndex.put(slide.getObjectId(), slide);
            }
        }
    }

    private void indexPages(List<Page> pages) {
        if (pages == null) {
            return;
        }
        for (Page page : pages) {
            if (page.getPageElements() == null) {
                continue;
            }
            for (PageElement element : page.getPageElements()) {
                if (element.getObjectId() != null) {
                    elementIndex.put(element.getObjectId(), element);
                }
            }
        }
    }

    public Presentation getPresentation() {
        return presentation;
    }

    public String getPresentationId() {
        return presentation.getPresentationId();
    }

    public Optional<Page> findSlide(String pageId) {
        return Optional.ofNullable(slideIndex.get(pageId));
    }

    public PageElement findElement(String objectId) {
        return objectId == null ? null : elementIndex.get(objectId);
    }

    /**
     * The layout or master placeholder the given placeholder inherits from, or null.
     */
    public PageElement findParent(PageElement element) {
        if (element == null) {
            return null;
        }
        Placeholder placeholder = element.placeholder();
        if (placeholder == null) {
            return null;
        }
        return findElement(placeholder.getParentObjectId());
    }

    /**
     * Placeholders of the given type on a slide, shapes and images alike, in page order.
     *
     * @return matching elements, empty when the slide has none
     * @throws DeckGenerationException if the slide is not part of this snapshot
     */
    public List<PageElement> findPlaceholders(String pageId, String type) {
        Page page = findSlide(pageId).orElseThrow(() -> new DeckGenerationException(
                "PAGE_NOT_FOUND", "Can't find page " + pageId + " in the current snapshot"));
        if (page.getPageElements() == null) {
            return Collections.emptyList();
        }
        List<PageElement> matches = new ArrayList<>();
        for (PageElement element : page.getPageElements()) {
            Placeholder placeholder = element.placeholder();
            if (placeholder != null && type.equals(placeholder.getType())) {
                matches.add(element);
            }
        }
        return matches;
    }

    public Optional<String> findLayoutIdByName(String name) {
        if (presentation.getLayouts() == null || name == null) {
            return Optional.empty();
        }
        return presentation.getLayouts().stream()
                .filter(layout -> layout.getLayoutProperties() != null
                        && name.equals(layout.getLayoutProperties().getName()))
                .map(Page::getObjectId)
                .findFirst();
    }

    public Optional<String> findSpeakerNotesObjectId(String pageId) {
        return findSlide(pageId)
                .map(Page::getSlideProperties)
                .map(properties -> properties.getNotesPage())
                .map(Page::getNotesProperties)
                .map(notes -> notes.getSpeakerNotesObjectId());
    }

    /**
     * @throws DeckGenerationException if the presentation carries no page size
     */
    public Size pageSize() {
        Size size = presentation.getPageSize();
        if (size == null || size.getWidth() == null || size.getHeight() == null
                || size.getWidth().getMagnitude() == null || size.getHeight().getMagnitude() == null) {
            throw new DeckGenerationException("PAGE_SIZE_MISSING",
                    "Presentation " + presentation.getPresentationId() + " has no page size");
        }
        return size;
    }

    public List<String> existingSlideIds() {
        return new ArrayList<>(slideIndex.keySet());
    }

    public int elementCount() {
        return elementIndex.size();
    }
}
