package com.github.stormino.streamcore.memory;

import com.github.stormino.streamcore.exception.MemorySamplingException;
import com.github.stormino.streamcore.model.MemoryReading;
import lombok.extern.slf4j.Slf4j;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;

/**
 * Cross-platform system memory sampler using OSHI.
 * <p>
 * Reports physical memory available to new processes, which is what the
 * media pipeline competes for.
 */
@Slf4j
public final class OshiMemorySampler implements MemorySampler {

    private final GlobalMemory memory;

    public OshiMemorySampler() {
        this(new SystemInfo().getHardware().getMemory());
    }

    OshiMemorySampler(GlobalMemory memory) {
        this.memory = memory;
    }

    @Override
    public MemoryReading sample() {
        long available;
        long total;
        try {
            available = memory.getAvailable();
            total = memory.getTotal();
        } catch (RuntimeException e) {
            throw new MemorySamplingException("OSHI memory query failed: " + e.getMessage(), getName(), e);
        }

        if (total <= 0 || available < 0) {
            throw new MemorySamplingException(
                    String.format("OSHI returned unusable memory values (available=%d, total=%d)", available, total),
                    getName());
        }
        return MemoryReading.of(available, total);
    }

    @Override
    public String getName() {
        return "oshi";
    }
}
