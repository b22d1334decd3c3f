package com.example.demo.deckgen.client;

import com.example.demo.deckgen.config.RemoteProperties;
import com.example.demo.deckgen.exception.RateLimitExceededException;
import com.example.demo.deckgen.exception.RemoteCallException;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.request.BatchUpdateRequest;
import com.example.demo.deckgen.remote.request.BatchUpdateResponse;
import com.example.demo.deckgen.remote.request.Request;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link SlidesClient} over the REST API, using a bearer token obtained elsewhere.
 */
@Slf4j
@Component
public class RestSlidesClient implements SlidesClient {

    private static final String SERVICE_NAME = "Presentation service";

    private final WebClient webClient;
    private final WebClient driveClient;
    private final ObjectMapper objectMapper;

    public RestSlidesClient(WebClient.Builder webClientBuilder, RemoteProperties properties, ObjectMapper objectMapper) {
        this.webClient = authorized(webClientBuilder.clone().baseUrl(properties.getBaseUrl()), properties).build();
        this.driveClient = authorized(webClientBuilder.clone().baseUrl(properties.getDriveUrl()), properties).build();
        this.objectMapper = objectMapper;
    }

    private static WebClient.Builder authorized(WebClient.Builder builder, RemoteProperties properties) {
        if (properties.getAccessToken() != null && !properties.getAccessToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAccessToken());
        }
        return builder;
    }

    @Override
    public Presentation getPresentation(String presentationId) {
        log.debug("Fetching presentation {}", presentationId);
        return throttleAware(() -> webClient.get()
                .uri("/presentations/{id}", presentationId)
                .retrieve()
                .bodyToMono(Presentation.class)
                .block());
    }

    @Override
    public Presentation createPresentation(String title) {
        log.debug("Creating presentation \"{}\"", title);
        return throttleAware(() -> webClient.post()
                .uri("/presentations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("title", title == null ? "" : title))
                .retrieve()
                .bodyToMono(Presentation.class)
                .block());
    }

    @Override
    public String copyPresentation(String templateId, String title) {
        log.debug("Copying template {} as \"{}\"", templateId, title);
        JsonNode copy = throttleAware(() -> driveClient.post()
                .uri("/files/{id}/copy", templateId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", title == null ? "" : title))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());
        if (copy == null || !copy.path("id").isTextual()) {
            throw new RemoteCallException(200, null, "Copy of template " + templateId + " returned no id", null);
        }
        return copy.path("id").asText();
    }

    @Override
    public BatchUpdateResponse batchUpdate(String presentationId, List<Request> requests) {
        log.debug("Sending batch of {} requests to {}", requests.size(), presentationId);
        return call(() -> webClient.post()
                .uri("/presentations/{id}:batchUpdate", presentationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new BatchUpdateRequest(requests))
                .retrieve()
                .bodyToMono(BatchUpdateResponse.class)
                .block());
    }

    /**
     * Batch rejections are translated per chunk by the dispatcher. Other calls only
     * need throttling told apart from plain failures.
     */
    private <T> T throttleAware(Supplier<T> exchange) {
        try {
            return call(exchange);
        } catch (RemoteCallException e) {
            if (e.isRateLimited()) {
                throw new RateLimitExceededException(SERVICE_NAME, e);
            }
            throw e;
        }
    }

    private <T> T call(Supplier<T> exchange) {
        try {
            return exchange.get();
        } catch (WebClientResponseException e) {
            throw toRemoteCallException(e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            throw new RemoteCallException(0, null, e.getMessage(), e);
        }
    }

    /**
     * Reads the service's error envelope, {@code {"error": {"code", "message", "status"}}}.
     * Bodies in any other shape are passed through as the message.
     */
    RemoteCallException toRemoteCallException(int httpStatus, String body, Throwable cause) {
        String status = null;
        String message = body;
        try {
            JsonNode error = body == null || body.isBlank() ? null : objectMapper.readTree(body).path("error");
            if (error != null && error.isObject()) {
                status = error.path("status").isTextual() ? error.path("status").asText() : null;
                message = error.path("message").isTextual() ? error.path("message").asText() : body;
            }
        } catch (Exception e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return new RemoteCallException(httpStatus, status, message, cause);
    }
}
