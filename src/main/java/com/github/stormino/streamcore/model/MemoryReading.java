package com.github.stormino.streamcore.model;

import lombok.Value;

/**
 * Raw measurement produced by a memory sampler, before it is timestamped.
 */
@Value
public class MemoryReading {

    long availableBytes;
    long totalBytes;
    long usedBytes;

    /**
     * Build a reading where used memory is whatever is not available.
     * Used bytes never go below zero, even if the sampler reports more
     * available memory than total memory.
     */
    public static MemoryReading of(long availableBytes, long totalBytes) {
        long used = totalBytes > availableBytes ? totalBytes - availableBytes : 0L;
        return new MemoryReading(availableBytes, totalBytes, used);
    }
}
