package com.github.stormino.streamcore.cleanup;

import com.github.stormino.streamcore.model.CleanupPriority;
import com.github.stormino.streamcore.model.CleanupResult;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * {@link ResourceCleaner} backed by a {@link ClearableCache}.
 */
@Slf4j
public class CacheCleaner implements ResourceCleaner {

    private final String resourceName;
    private final CleanupPriority priority;
    private final ClearableCache cache;

    public CacheCleaner(@NonNull String resourceName, @NonNull CleanupPriority priority, @NonNull ClearableCache cache) {
        this.resourceName = resourceName;
        this.priority = priority;
        this.cache = cache;
    }

    /**
     * Cleaner for decoded thumbnails and artwork.
     */
    public static CacheCleaner imageCache(ClearableCache cache) {
        return new CacheCleaner("Image Cache", CleanupPriority.MEDIUM, cache);
    }

    /**
     * Cleaner for cached video segments, the largest consumer.
     */
    public static CacheCleaner videoCache(ClearableCache cache) {
        return new CacheCleaner("Video Cache", CleanupPriority.HIGH, cache);
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    @Override
    public CleanupPriority getPriority() {
        return priority;
    }

    @Override
    public long estimateCleanup() {
        return Math.max(0L, cache.estimateSize());
    }

    @Override
    public CleanupResult cleanup() {
        long sizeBefore = estimateCleanup();
        try {
            int itemsRemoved = cache.clearAll();
            long bytesFreed = Math.max(0L, sizeBefore - estimateCleanup());
            log.debug("{} cleared: {} items, {} bytes", resourceName, itemsRemoved, bytesFreed);
            return CleanupResult.success(resourceName, bytesFreed, itemsRemoved);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to clear {}: {}", resourceName, e.getMessage());
            return CleanupResult.failure(resourceName, e.getMessage());
        }
    }
}
