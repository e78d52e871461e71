package com.github.stormino.streamcore.model;

import com.github.stormino.streamcore.util.ByteUnits;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of releasing a single resource.
 */
@Value
@Builder
public class CleanupResult {

    String resourceName;
    long bytesFreed;
    int itemsRemoved;
    boolean success;

    /**
     * Error message if cleanup failed, null otherwise.
     */
    String error;

    public static CleanupResult success(String resourceName, long bytesFreed, int itemsRemoved) {
        return CleanupResult.builder()
                .resourceName(resourceName)
                .bytesFreed(bytesFreed)
                .itemsRemoved(itemsRemoved)
                .success(true)
                .build();
    }

    public static CleanupResult failure(String resourceName, String error) {
        return CleanupResult.builder()
                .resourceName(resourceName)
                .success(false)
                .error(error)
                .build();
    }

    public double getFreedMb() {
        return ByteUnits.toMegabytes(bytesFreed);
    }
}
