package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.client.ImageUploader;
import com.example.demo.deckgen.config.UploadProperties;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.exception.ImageUploadException;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.SlideDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Replaces local ({@code file:}) image URLs with public ones before any request that
 * references them is built. Uploads are started at a paced rate, run concurrently and
 * are all awaited before returning.
 */
@Slf4j
@Service
public class UploadScheduler {

    static final String FILE_SCHEME = "file:";

    private final ImageUploader uploader;
    private final UploadProperties properties;
    private final Sleeper sleeper;
    private final Executor executor;

    public UploadScheduler(ImageUploader uploader, UploadProperties properties, Sleeper sleeper,
                           @Qualifier("uploadExecutor") Executor executor) {
        this.uploader = uploader;
        this.properties = properties;
        this.sleeper = sleeper;
        this.executor = executor;
    }

    /**
     * Uploads every distinct local image of the deck and rewrites the URLs in place.
     *
     * @return number of files uploaded
     * @throws ImageUploadException if uploads are not allowed or one of them fails
     */
    @LogExecutionTime("Image Uploads")
    public int uploadLocalImages(List<SlideDefinition> slides, boolean allowUpload) {
        Map<String, List<ImageDefinition>> byPath = new LinkedHashMap<>();
        for (SlideDefinition slide : slides) {
            for (ImageDefinition image : slide.allImages()) {
                if (isLocal(image.getUrl())) {
                    byPath.computeIfAbsent(image.getUrl(), k -> new ArrayList<>()).add(image);
                }
            }
        }
        if (byPath.isEmpty()) {
            return 0;
        }
        if (!allowUpload) {
            throw new ImageUploadException("Deck references " + byPath.size()
                    + " local image(s) but uploads are not allowed: " + byPath.keySet());
        }
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new ImageUploadException("Deck references local images but no upload API key is configured");
        }

        log.info("Uploading {} local image(s)", byPath.size());
        List<CompletableFuture<Void>> uploads = new ArrayList<>();
        int i = 0;
        for (Map.Entry<String, List<ImageDefinition>> entry : byPath.entrySet()) {
            sleeper.sleep(properties.getRequestDelay());
            if (i % Math.max(1, properties.getBurstSize()) == 0) {
                sleeper.sleep(properties.getBurstPause());
            }
            i++;
            Path path = toPath(entry.getKey());
            List<ImageDefinition> images = entry.getValue();
            uploads.add(CompletableFuture
                    .supplyAsync(() -> uploader.upload(path), executor)
                    .thenAccept(url -> images.forEach(image -> image.setUrl(url))));
        }

        try {
            CompletableFuture.allOf(uploads.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DeckGenerationException) {
                throw (DeckGenerationException) cause;
            }
            throw new ImageUploadException("Image upload failed: " + cause.getMessage(), cause);
        }
        return byPath.size();
    }

    static boolean isLocal(String url) {
        return url != null && url.startsWith(FILE_SCHEME);
    }

    /**
     * Accepts both {@code file:///abs/path} and the relative form {@code file:dir/img.png}.
     */
    static Path toPath(String url) {
        String rest = url.substring(FILE_SCHEME.length());
        if (rest.startsWith("//")) {
            return Paths.get(URI.create(url));
        }
        return Paths.get(rest);
    }
}
