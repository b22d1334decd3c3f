package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.exception.BatchRejectedException;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.exception.RateLimitExceededException;
import com.example.demo.deckgen.exception.RemoteCallException;
import com.example.demo.deckgen.remote.request.Request;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a failed batch call into the exception the caller sees: throttling, or a
 * rejection pointing at the request that caused it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteErrorTranslator {

    private static final Pattern REQUEST_INDEX = Pattern.compile("requests\\[([0-9]+)\\]");

    private final ObjectMapper objectMapper;

    public DeckGenerationException translate(RemoteCallException error, Chunk chunk) {
        if (isRateLimited(error)) {
            return new RateLimitExceededException("Presentation service", error);
        }
        int index = parseIndex(error.getRemoteMessage());
        if (index < 0 || index >= chunk.getRequests().size()) {
            return new BatchRejectedException(error.getRemoteMessage(), -1, null, error);
        }
        Request failed = chunk.getRequests().get(index);
        return new BatchRejectedException(error.getRemoteMessage(), chunk.getOffset() + index, toJson(failed), error);
    }

    static boolean isRateLimited(RemoteCallException error) {
        return error.isRateLimited();
    }

    /**
     * Index named by a message such as "Invalid requests[3].createImage: ...", or -1.
     */
    static int parseIndex(String message) {
        if (message == null) {
            return -1;
        }
        Matcher matcher = REQUEST_INDEX.matcher(message);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private String toJson(Request request) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize failed request: {}", e.getMessage());
            return request.toString();
        }
    }
}
