package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.remote.request.Request;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a batch so that no chunk carries more than the allowed number of rate-limited
 * requests. A chunk is only ever closed right before a rate-limited request, which keeps
 * every follow-up request (alt text, properties) in the chunk of the element it refers to.
 */
@Component
@RequiredArgsConstructor
public class ChunkPlanner {

    private final DispatchProperties properties;

    public List<Chunk> plan(List<Request> requests) {
        if (requests.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> limitedKinds = new HashSet<>(properties.getRateLimitedKinds());
        int cap = Math.max(1, properties.getMaxRateLimitedPerChunk());

        List<Chunk> chunks = new ArrayList<>();
        List<Request> current = new ArrayList<>();
        int offset = 0;
        int limitedInChunk = 0;
        for (int i = 0; i < requests.size(); i++) {
            Request request = requests.get(i);
            boolean limited = limitedKinds.contains(request.kind());
            if (limited && limitedInChunk == cap) {
                chunks.add(new Chunk(offset, current));
                current = new ArrayList<>();
                offset = i;
                limitedInChunk = 0;
            }
            current.add(request);
            if (limited) {
                limitedInChunk++;
            }
        }
        chunks.add(new Chunk(offset, current));
        return chunks;
    }
}
