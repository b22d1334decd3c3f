package com.example.demo.deckgen.core;

import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.remote.NotesProperties;
import com.example.demo.deckgen.remote.Page;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.SlideProperties;
import com.example.demo.deckgen.support.TestPresentations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Document Snapshot Tests")
public class DocumentSnapshotTest {

    private Presentation presentation;
    private DocumentSnapshot snapshot;

    @BeforeEach
    public void setup() {
        presentation = TestPresentations.standardDeck("p1");
        List<PageElement> elements = new ArrayList<>();
        elements.add(TestPresentations.unsizedShape("s1_title", "TITLE", "layout_body_title"));
        elements.add(TestPresentations.unsizedShape("s1_body", "BODY", "layout_body_body"));
        elements.add(TestPresentations.picture("s1_pic", "layout_body_picture", 460, 90, 240, 180));
        Page notes = Page.builder().objectId("s1_notes").notesProperties(new NotesProperties("s1_speaker")).build();
        presentation.getSlides().add(Page.builder()
                .objectId("s1")
                .pageElements(elements)
                .slideProperties(SlideProperties.builder().notesPage(notes).build())
                .build());
        snapshot = new DocumentSnapshot(presentation);
    }

    @Test
    public void testFindPlaceholdersByType() {
        assertEquals(1, snapshot.findPlaceholders("s1", "BODY").size());
        assertEquals("s1_pic", snapshot.findPlaceholders("s1", "PICTURE").get(0).getObjectId());
        assertTrue(snapshot.findPlaceholders("s1", "SUBTITLE").isEmpty());
    }

    @Test
    @DisplayName("Unknown page means the snapshot is stale")
    public void testUnknownPage() {
        DeckGenerationException e = assertThrows(DeckGenerationException.class,
                () -> snapshot.findPlaceholders("not-there", "BODY"));
        assertEquals("PAGE_NOT_FOUND", e.getCode());
    }

    @Test
    public void testIndexesLayoutsAndMasters() {
        PageElement body = snapshot.findElement("s1_body");
        assertEquals("layout_body_body", snapshot.findParent(body).getObjectId());
        assertEquals("master_body", snapshot.findParent(snapshot.findParent(body)).getObjectId());
        assertNull(snapshot.findElement(null));
    }

    @Test
    public void testLayoutAndNotesLookups() {
        assertEquals("layout_body", snapshot.findLayoutIdByName("TITLE_AND_BODY").orElseThrow());
        assertTrue(snapshot.findLayoutIdByName("NOPE").isEmpty());
        assertEquals("s1_speaker", snapshot.findSpeakerNotesObjectId("s1").orElseThrow());
        assertEquals(List.of("s1"), snapshot.existingSlideIds());
    }

    @Test
    public void testPageSize() {
        assertEquals(9_144_000.0, snapshot.pageSize().getWidth().getMagnitude(), 1e-6);

        presentation.setPageSize(null);
        DeckGenerationException e = assertThrows(DeckGenerationException.class,
                () -> new DocumentSnapshot(presentation).pageSize());
        assertEquals("PAGE_SIZE_MISSING", e.getCode());
    }
}
