package com.example.demo.deckgen.core;

import com.example.demo.deckgen.autofit.FontSizeKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

/**
 * State of one rendering run: the current document snapshot and the autofit
 * memo cache tied to it. Reloading the snapshot drops the cache because the
 * element ids it is keyed by belong to the old read.
 */
@Slf4j
public class RenderContext {
    private DocumentSnapshot snapshot;
    private final Cache<FontSizeKey, Double> fontSizeCache;
    private int reloadCount;

    public RenderContext(DocumentSnapshot snapshot) {
        this(snapshot, 10_000);
    }

    public RenderContext(DocumentSnapshot snapshot, long cacheMaximumSize) {
        this.snapshot = snapshot;
        this.fontSizeCache = Caffeine.newBuilder()
                .maximumSize(cacheMaximumSize)
                .recordStats()
                .build();
    }

    public DocumentSnapshot getSnapshot() {
        return snapshot;
    }

    public String getPresentationId() {
        return snapshot.getPresentationId();
    }

    /**
     * Swap in a freshly fetched snapshot and invalidate everything derived from the old one.
     */
    public void reload(DocumentSnapshot fresh) {
        log.debug("Reloading snapshot of {} ({} elements), dropping {} cached font sizes",
                fresh.getPresentationId(), fresh.elementCount(), fontSizeCache.estimatedSize());
        this.snapshot = fresh;
        this.fontSizeCache.invalidateAll();
        this.reloadCount++;
    }

    public Cache<FontSizeKey, Double> getFontSizeCache() {
        return fontSizeCache;
    }

    public int getReloadCount() {
        return reloadCount;
    }
}
