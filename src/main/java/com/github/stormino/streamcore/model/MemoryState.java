package com.github.stormino.streamcore.model;

import com.github.stormino.streamcore.util.ByteUnits;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time memory snapshot. A new instance is produced for every sample.
 */
@Value
@Builder
public class MemoryState {

    long availableBytes;
    long totalBytes;
    long usedBytes;

    @NonNull
    Instant timestamp;

    public static MemoryState of(@NonNull MemoryReading reading, @NonNull Instant timestamp) {
        return MemoryState.builder()
                .availableBytes(reading.getAvailableBytes())
                .totalBytes(reading.getTotalBytes())
                .usedBytes(reading.getUsedBytes())
                .timestamp(timestamp)
                .build();
    }

    public double getAvailableMb() {
        return ByteUnits.toMegabytes(availableBytes);
    }

    public double getUsedMb() {
        return ByteUnits.toMegabytes(usedBytes);
    }

    /**
     * Share of total memory in use, 0-100. Zero when total memory is unknown.
     */
    public double getUsagePercentage() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return (double) usedBytes / totalBytes * 100.0;
    }

    public MemoryPressureLevel pressureLevel(@NonNull MemoryThresholds thresholds) {
        return thresholds.pressureLevel(getAvailableMb());
    }
}
