package com.github.stormino.streamcore.memory;

import com.github.stormino.streamcore.exception.MemorySamplingException;
import com.github.stormino.streamcore.model.MemoryReading;

/**
 * Source of raw memory measurements. Implementations wrap a platform API.
 */
public interface MemorySampler {

    /**
     * Take one measurement.
     *
     * @return current reading
     * @throws MemorySamplingException if the underlying source is unavailable
     */
    MemoryReading sample();

    /**
     * Short name used in log lines.
     */
    String getName();
}
