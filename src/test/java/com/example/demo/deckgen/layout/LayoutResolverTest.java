package com.example.demo.deckgen.layout;

import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.exception.LayoutNotFoundException;
import com.example.demo.deckgen.model.Body;
import com.example.demo.deckgen.model.SlideDefinition;
import com.example.demo.deckgen.model.TableDefinition;
import com.example.demo.deckgen.model.TextDefinition;
import com.example.demo.deckgen.support.TestPresentations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Layout Resolver Tests")
public class LayoutResolverTest {

    private final LayoutResolver resolver = new LayoutResolver();
    private final DocumentSnapshot snapshot = new DocumentSnapshot(TestPresentations.standardDeck("p1"));

    private static Body body(String text) {
        return Body.builder().text(TextDefinition.of(text)).build();
    }

    @Test
    @DisplayName("Title with subtitle and nothing else is a title slide")
    public void testTitleSlide() {
        SlideDefinition slide = SlideDefinition.builder()
                .title(TextDefinition.of("Deck"))
                .subtitle(TextDefinition.of("2024"))
                .build();
        assertEquals(LayoutResolver.TITLE, resolver.layoutNameFor(slide));
        assertEquals("layout_title", resolver.resolveLayoutId(slide, snapshot));
    }

    @Test
    public void testSectionHeader() {
        SlideDefinition slide = SlideDefinition.builder().title(TextDefinition.of("Part 1")).build();
        assertEquals(LayoutResolver.SECTION_HEADER, resolver.layoutNameFor(slide));
    }

    @Test
    public void testContentLayouts() {
        SlideDefinition oneBody = SlideDefinition.builder()
                .title(TextDefinition.of("Agenda"))
                .bodies(List.of(body("a")))
                .build();
        SlideDefinition twoBodies = SlideDefinition.builder()
                .bodies(List.of(body("left"), body("right")))
                .build();
        SlideDefinition tableOnly = SlideDefinition.builder()
                .tables(List.of(TableDefinition.builder().rows(1).columns(1).build()))
                .build();

        assertEquals(LayoutResolver.TITLE_AND_BODY, resolver.layoutNameFor(oneBody));
        assertEquals(LayoutResolver.TITLE_AND_TWO_COLUMNS, resolver.layoutNameFor(twoBodies));
        assertEquals(LayoutResolver.TITLE_AND_BODY, resolver.layoutNameFor(tableOnly));
        assertEquals("layout_two", resolver.resolveLayoutId(twoBodies, snapshot));
    }

    @Test
    @DisplayName("Empty title text does not count as a title")
    public void testBlank() {
        SlideDefinition slide = SlideDefinition.builder().title(TextDefinition.of("")).build();
        assertEquals(LayoutResolver.BLANK, resolver.layoutNameFor(slide));
    }

    @Test
    @DisplayName("An explicit layout wins over the derived one")
    public void testCustomLayout() {
        SlideDefinition slide = SlideDefinition.builder()
                .customLayout("BLANK")
                .title(TextDefinition.of("Ignored for layout"))
                .build();
        assertEquals("layout_blank", resolver.resolveLayoutId(slide, snapshot));
    }

    @Test
    public void testUnknownLayout() {
        SlideDefinition slide = SlideDefinition.builder().customLayout("MAIN_POINT").build();

        LayoutNotFoundException e = assertThrows(LayoutNotFoundException.class,
                () -> resolver.resolveLayoutId(slide, snapshot));
        assertEquals("LAYOUT_NOT_FOUND", e.getCode());
        assertTrue(e.getDescription().contains("MAIN_POINT"));
    }
}
