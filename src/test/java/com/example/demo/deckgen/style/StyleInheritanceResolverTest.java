package com.example.demo.deckgen.style;

import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.remote.Dimension;
import com.example.demo.deckgen.remote.Page;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.ParagraphStyle;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.TextStyle;
import com.example.demo.deckgen.remote.WeightedFontFamily;
import com.example.demo.deckgen.support.TestPresentations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Style Inheritance Resolver Tests")
public class StyleInheritanceResolverTest {

    private final StyleInheritanceResolver resolver = new StyleInheritanceResolver();

    private static DocumentSnapshot snapshotWith(PageElement... slideElements) {
        Presentation presentation = TestPresentations.standardDeck("p1");
        presentation.getSlides().add(Page.builder()
                .objectId("s1")
                .pageElements(new ArrayList<>(Arrays.asList(slideElements)))
                .build());
        return new DocumentSnapshot(presentation);
    }

    private static List<String> ids(List<PageElement> chain) {
        return chain.stream().map(PageElement::getObjectId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Chain runs from the master down to the element itself")
    public void testAncestorChainOrder() {
        PageElement body = TestPresentations.unsizedShape("s1_body", "BODY", "layout_body_body");
        DocumentSnapshot snapshot = snapshotWith(body);

        List<PageElement> chain = resolver.ancestorChain(body, snapshot);

        assertEquals(List.of("master_body", "layout_body_body", "s1_body"), ids(chain));
    }

    @Test
    @DisplayName("Inherits master styles when nothing overrides them")
    public void testResolvesInheritedStyle() {
        PageElement body = TestPresentations.unsizedShape("s1_body", "BODY", "layout_body_body");
        EffectiveStyle style = resolver.resolve(body, snapshotWith(body));

        assertEquals(16.0, style.getFontSize());
        assertEquals("Arial", style.getFontFamily());
        assertEquals(115.0, style.getLineSpacing());
        assertEquals(400, style.getWeight());
    }

    @Test
    @DisplayName("Younger layers win per field")
    public void testYoungestWins() {
        PageElement body = TestPresentations.withStyle(
                TestPresentations.unsizedShape("s1_body", "BODY", "layout_body_body"),
                ParagraphStyle.builder().spaceAbove(Dimension.pt(6)).build(),
                TextStyle.builder()
                        .fontSize(Dimension.pt(20))
                        .weightedFontFamily(new WeightedFontFamily("Roboto", 700))
                        .build());

        EffectiveStyle style = resolver.resolve(body, snapshotWith(body));

        assertEquals(20.0, style.getFontSize());
        assertEquals("Roboto", style.getFontFamily());
        assertEquals(700, style.getWeight());
        assertEquals(6.0, style.getSpaceAbove());
        assertEquals(115.0, style.getLineSpacing());
    }

    @Test
    @DisplayName("Defaults apply to an element without ancestors or styles")
    public void testDefaults() {
        PageElement loose = TestPresentations.unsizedShape("loose", "BODY", null);
        EffectiveStyle style = resolver.resolve(loose, snapshotWith(loose));

        assertEquals(EffectiveStyle.defaults(), style);
        assertEquals("START", style.getAlignment());
        assertEquals("LEFT_TO_RIGHT", style.getDirection());
        assertEquals("NEVER_COLLAPSE", style.getSpacingMode());
    }

    @Test
    @DisplayName("A parent cycle is cut without failing")
    public void testCycleIsTruncated() {
        PageElement a = TestPresentations.unsizedShape("a", "BODY", "b");
        PageElement b = TestPresentations.unsizedShape("b", "BODY", "a");

        List<PageElement> chain = resolver.ancestorChain(a, snapshotWith(a, b));

        assertEquals(List.of("b", "a"), ids(chain));
    }

    @Test
    @DisplayName("Traversal stops after three parent lookups")
    public void testDepthIsBounded() {
        PageElement e0 = TestPresentations.unsizedShape("e0", "BODY", "e1");
        PageElement e1 = TestPresentations.unsizedShape("e1", "BODY", "e2");
        PageElement e2 = TestPresentations.unsizedShape("e2", "BODY", "e3");
        PageElement e3 = TestPresentations.unsizedShape("e3", "BODY", "e4");
        PageElement e4 = TestPresentations.unsizedShape("e4", "BODY", null);

        List<PageElement> chain = resolver.ancestorChain(e0, snapshotWith(e0, e1, e2, e3, e4));

        assertEquals(List.of("e3", "e2", "e1", "e0"), ids(chain));
    }

    @Test
    @DisplayName("A dangling parent id ends the chain")
    public void testMissingParent() {
        PageElement orphan = TestPresentations.unsizedShape("orphan", "BODY", "gone");
        assertEquals(List.of("orphan"), ids(resolver.ancestorChain(orphan, snapshotWith(orphan))));
    }
}
