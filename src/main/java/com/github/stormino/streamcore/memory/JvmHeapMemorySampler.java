package com.github.stormino.streamcore.memory;

import com.github.stormino.streamcore.model.MemoryReading;

/**
 * Samples the JVM heap rather than physical memory.
 * <p>
 * Available memory is the headroom up to {@link Runtime#maxMemory()}, i.e. free
 * heap plus the part of the heap the JVM has not committed yet. Off-heap
 * allocations are not visible here.
 */
public final class JvmHeapMemorySampler implements MemorySampler {

    private final Runtime runtime;

    public JvmHeapMemorySampler() {
        this(Runtime.getRuntime());
    }

    JvmHeapMemorySampler(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public MemoryReading sample() {
        long max = runtime.maxMemory();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return MemoryReading.of(Math.max(0L, max - used), max);
    }

    @Override
    public String getName() {
        return "jvm-heap";
    }
}
