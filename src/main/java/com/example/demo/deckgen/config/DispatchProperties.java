package com.example.demo.deckgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Chunking and pacing of the mutation batches sent to the presentation service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "deckgen.dispatch")
public class DispatchProperties {

    /**
     * Cap on rate-limited requests (see {@link #rateLimitedKinds}) within one chunk.
     */
    private int maxRateLimitedPerChunk = 6;

    /**
     * Request kinds counted against the cap. Images are fetched by the remote service
     * from the upload host, which has its own request ceiling.
     */
    private List<String> rateLimitedKinds = new ArrayList<>(List.of("createImage"));

    /**
     * Minimum delay between two successive chunks.
     */
    private Duration chunkDelay = Duration.ofSeconds(2);

    /**
     * Read the document again once the populate pass has been dispatched.
     */
    private boolean reloadAfterPopulate = true;
}
