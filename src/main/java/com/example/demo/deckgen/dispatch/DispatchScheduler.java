package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.client.SlidesClient;
import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.exception.RemoteCallException;
import com.example.demo.deckgen.remote.request.Request;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends a batch as a sequence of chunks, pausing between them. Chunks go out strictly
 * in order and the first failure aborts the rest; nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchScheduler {

    private final SlidesClient slidesClient;
    private final ChunkPlanner chunkPlanner;
    private final RemoteErrorTranslator errorTranslator;
    private final DispatchProperties properties;
    private final Sleeper sleeper;

    /**
     * @return number of chunks sent, 0 for an empty batch
     * @throws com.example.demo.deckgen.exception.BatchRejectedException if the service rejects a chunk
     * @throws com.example.demo.deckgen.exception.RateLimitExceededException if the service throttles us
     */
    @LogExecutionTime("Batch Dispatch")
    public int dispatch(String presentationId, List<Request> requests) {
        List<Chunk> chunks = chunkPlanner.plan(requests);
        if (chunks.isEmpty()) {
            log.debug("Nothing to dispatch to {}", presentationId);
            return 0;
        }
        log.info("Dispatching {} requests to {} in {} chunk(s)", requests.size(), presentationId, chunks.size());

        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) {
                sleeper.sleep(properties.getChunkDelay());
            }
            Chunk chunk = chunks.get(i);
            log.debug("Chunk {}/{}: requests {}..{}", i + 1, chunks.size(),
                    chunk.getOffset(), chunk.getOffset() + chunk.getRequests().size() - 1);
            try {
                slidesClient.batchUpdate(presentationId, chunk.getRequests());
            } catch (RemoteCallException e) {
                DeckGenerationException translated = errorTranslator.translate(e, chunk);
                log.error("Chunk {}/{} failed: {}", i + 1, chunks.size(), translated.getDescription());
                throw translated;
            }
        }
        return chunks.size();
    }
}
