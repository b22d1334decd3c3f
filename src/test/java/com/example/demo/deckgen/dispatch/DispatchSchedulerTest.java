package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.exception.BatchRejectedException;
import com.example.demo.deckgen.exception.RateLimitExceededException;
import com.example.demo.deckgen.exception.RemoteCallException;
import com.example.demo.deckgen.support.FakeSlidesClient;
import com.example.demo.deckgen.support.RecordingSleeper;
import com.example.demo.deckgen.support.TestPresentations;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dispatch Scheduler Tests")
public class DispatchSchedulerTest {

    private RecordingSleeper sleeper;
    private FakeSlidesClient client;
    private DispatchScheduler scheduler;

    @BeforeEach
    public void setup() {
        sleeper = new RecordingSleeper();
        client = new FakeSlidesClient(TestPresentations.standardDeck("p1"), sleeper);
        DispatchProperties properties = new DispatchProperties();
        scheduler = new DispatchScheduler(client, new ChunkPlanner(properties),
                new RemoteErrorTranslator(new ObjectMapper()), properties, sleeper);
    }

    @Test
    @DisplayName("An empty batch makes no remote call")
    public void testEmptyBatch() {
        assertEquals(0, scheduler.dispatch("p1", List.of()));
        assertTrue(client.getBatches().isEmpty());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    public void testSingleChunkIsNotDelayed() {
        assertEquals(1, scheduler.dispatch("p1", DispatchRequests.images(6)));
        assertEquals(1, client.getBatches().size());
        assertEquals(0, sleeper.totalMillis());
    }

    @Test
    @DisplayName("Chunks are spaced at least two seconds apart")
    public void testChunksArePaced() {
        assertEquals(4, scheduler.dispatch("p1", DispatchRequests.images(20)));

        assertEquals(4, client.getBatches().size());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeper.getSleeps());
        List<Long> times = client.getBatchTimes();
        for (int i = 1; i < times.size(); i++) {
            assertTrue(times.get(i) - times.get(i - 1) >= 2000);
        }
    }

    @Test
    @DisplayName("A rejected chunk reports the index within the whole batch and stops dispatch")
    public void testRejectedChunk() {
        client.failBatch(1, new RemoteCallException(400, "INVALID_ARGUMENT",
                "Invalid requests[2].createImage: Access to the provided image was forbidden.", null));

        BatchRejectedException e = assertThrows(BatchRejectedException.class,
                () -> scheduler.dispatch("p1", DispatchRequests.images(20)));

        assertEquals(14, e.getRequestIndex());
        assertTrue(e.getFailedRequest().contains("img7"));
        assertEquals(2, client.getBatches().size());
    }

    @Test
    public void testRateLimitedChunk() {
        client.failBatch(0, new RemoteCallException(429, "RESOURCE_EXHAUSTED", "Quota exceeded", null));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> scheduler.dispatch("p1", DispatchRequests.images(1)));
        assertEquals("RATE_LIMITED", e.getCode());
        assertEquals(1, client.getBatches().size());
    }
}
