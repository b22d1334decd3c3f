package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.remote.request.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Chunk Planner Tests")
public class ChunkPlannerTest {

    private final ChunkPlanner planner = new ChunkPlanner(new DispatchProperties());

    @Test
    public void testEmptyBatch() {
        assertTrue(planner.plan(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Batches without images go out in one chunk")
    public void testTextOnlyBatch() {
        List<Request> requests = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            requests.add(DispatchRequests.text("shape" + i));
        }

        List<Chunk> chunks = planner.plan(requests);

        assertEquals(1, chunks.size());
        assertEquals(requests, chunks.get(0).getRequests());
    }

    @Test
    @DisplayName("Twenty images are split six per chunk")
    public void testImagesAreCapped() {
        List<Request> requests = DispatchRequests.images(20);

        List<Chunk> chunks = planner.plan(requests);

        assertEquals(4, chunks.size());
        assertEquals(List.of(0, 12, 24, 36), List.of(chunks.get(0).getOffset(), chunks.get(1).getOffset(),
                chunks.get(2).getOffset(), chunks.get(3).getOffset()));
        List<Request> joined = new ArrayList<>();
        for (Chunk chunk : chunks) {
            long images = chunk.getRequests().stream().filter(r -> r.getCreateImage() != null).count();
            assertTrue(images <= 6);
            joined.addAll(chunk.getRequests());
        }
        assertEquals(requests, joined, "chunks concatenate back to the original batch");
    }

    @Test
    @DisplayName("Alt text stays in the chunk of its image")
    public void testFollowUpStaysWithImage() {
        List<Chunk> chunks = planner.plan(DispatchRequests.images(7));

        assertEquals(2, chunks.size());
        assertEquals(Request.UPDATE_PAGE_ELEMENT_ALT_TEXT, chunks.get(0).getRequests().get(11).kind());
        assertEquals(Request.CREATE_IMAGE, chunks.get(1).getRequests().get(0).kind());
    }

    @Test
    public void testCustomCapAndKinds() {
        DispatchProperties properties = new DispatchProperties();
        properties.setMaxRateLimitedPerChunk(2);
        properties.setRateLimitedKinds(List.of(Request.INSERT_TEXT));
        List<Request> requests = new ArrayList<>(DispatchRequests.images(3));
        requests.add(DispatchRequests.text("a"));
        requests.add(DispatchRequests.text("b"));
        requests.add(DispatchRequests.text("c"));

        List<Chunk> chunks = new ChunkPlanner(properties).plan(requests);

        assertEquals(2, chunks.size());
        assertEquals(8, chunks.get(0).getRequests().size());
        assertEquals(8, chunks.get(1).getOffset());
    }
}
