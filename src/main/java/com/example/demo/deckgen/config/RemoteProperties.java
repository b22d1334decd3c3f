package com.example.demo.deckgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection to the remote presentation service. Obtaining the access token is
 * the caller's business; it is handed over as configuration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "deckgen.remote")
public class RemoteProperties {

    private String baseUrl = "https://slides.googleapis.com/v1";

    /**
     * File API used to copy template presentations.
     */
    private String driveUrl = "https://www.googleapis.com/drive/v3";

    private String accessToken;
}
