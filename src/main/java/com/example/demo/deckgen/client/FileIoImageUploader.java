package com.example.demo.deckgen.client;

import com.example.demo.deckgen.config.UploadProperties;
import com.example.demo.deckgen.exception.ImageUploadException;
import com.example.demo.deckgen.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Uploads to an ephemeral file host (file.io style API): multipart POST, the file is
 * deleted after its first download or when it expires.
 */
@Slf4j
@Component
public class FileIoImageUploader implements ImageUploader {

    static final int THROTTLED_STATUS = 492;
    static final String THROTTLED_CODE = "TOO_MANY_REQUESTS";
    private static final String SERVICE = "Image host";

    private final WebClient webClient;
    private final UploadProperties properties;

    public FileIoImageUploader(WebClient.Builder webClientBuilder, UploadProperties properties) {
        this.webClient = webClientBuilder.clone().build();
        this.properties = properties;
    }

    @Override
    public String upload(Path file) {
        if (!Files.isReadable(file)) {
            throw new ImageUploadException("Local image " + file + " does not exist or is not readable");
        }
        log.debug("Uploading {}", file);

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new FileSystemResource(file));
        body.part("expires", properties.getExpires());
        body.part("autoDelete", "true");

        Map<?, ?> response;
        try {
            response = webClient.post()
                    .uri(properties.getEndpoint())
                    .header(HttpHeaders.AUTHORIZATION, properties.getApiKey())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == THROTTLED_STATUS || e.getStatusCode().value() == 429
                    || e.getResponseBodyAsString().contains(THROTTLED_CODE)) {
                throw new RateLimitExceededException(SERVICE, e);
            }
            throw new ImageUploadException("Unable to upload " + file + ": HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new ImageUploadException("Unable to upload " + file + ": " + e.getMessage(), e);
        }
        return linkFrom(response, file);
    }

    /**
     * The host may report failures inside a 200 response, {@code {"success": false, "status": 492, ...}}.
     */
    String linkFrom(Map<?, ?> response, Path file) {
        if (response == null) {
            throw new ImageUploadException("Empty response uploading " + file);
        }
        if (!Boolean.TRUE.equals(response.get("success"))) {
            Object status = response.get("status");
            if (String.valueOf(THROTTLED_STATUS).equals(String.valueOf(status))
                    || THROTTLED_CODE.equals(response.get("code"))) {
                throw new RateLimitExceededException(SERVICE, null);
            }
            throw new ImageUploadException("Unable to upload " + file + ": " + response);
        }
        Object link = response.get("link");
        if (link == null) {
            throw new ImageUploadException("Upload of " + file + " returned no link");
        }
        log.debug("Temporary link for {}: {}", file, link);
        return link.toString();
    }
}
