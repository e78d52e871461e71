package com.github.stormino.streamcore.cleanup;

import com.github.stormino.streamcore.model.CleanupPriority;
import com.github.stormino.streamcore.model.CleanupResult;

/**
 * A resource that can be released under memory pressure.
 * <p>
 * Cleanup must be idempotent and estimation must not change any state.
 * Implementations report failures through {@link CleanupResult#failure}
 * rather than throwing.
 */
public interface ResourceCleaner {

    String getResourceName();

    CleanupPriority getPriority();

    /**
     * @return bytes that cleanup would free, without cleaning
     */
    long estimateCleanup();

    CleanupResult cleanup();
}
