package com.github.stormino.streamcore.model;

/**
 * Order in which cleanable resources are released under memory pressure.
 * Higher priorities are cleaned first.
 */
public enum CleanupPriority {
    /** Nice to have cleared, e.g. prefetched thumbnails. */
    LOW,
    /** Should be cleared under memory pressure, e.g. the image cache. */
    MEDIUM,
    /** Must be cleared when memory is critical, e.g. cached video segments. */
    HIGH;

    public boolean isAtMost(CleanupPriority bound) {
        return compareTo(bound) <= 0;
    }
}
