package com.example.demo.deckgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Local image uploads to the temporary hosting service (8 requests/sec ceiling).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "deckgen.upload")
public class UploadProperties {

    private String endpoint = "https://file.io";

    /**
     * Key sent in the Authorization header. Uploads are refused when blank.
     */
    private String apiKey;

    /**
     * How long the hosted copy stays available.
     */
    private String expires = "5m";

    private Duration requestDelay = Duration.ofMillis(150);

    /**
     * Extra pause taken every {@link #burstSize} uploads.
     */
    private Duration burstPause = Duration.ofMillis(250);

    private int burstSize = 6;

    private int concurrency = 4;
}
