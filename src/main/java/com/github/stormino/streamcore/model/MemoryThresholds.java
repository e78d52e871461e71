package com.github.stormino.streamcore.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Maps available memory to a {@link MemoryPressureLevel} and sets the sampling cadence.
 * <p>
 * Classification only makes sense when {@code criticalAvailableMb < warningAvailableMb};
 * the value itself does not enforce it, {@code StreamCoreProperties} does.
 */
@Value
@Builder
public class MemoryThresholds {

    public static final MemoryThresholds DEFAULT = MemoryThresholds.builder()
            .warningAvailableMb(100.0)
            .criticalAvailableMb(50.0)
            .pollingInterval(Duration.ofSeconds(2))
            .build();

    double warningAvailableMb;
    double criticalAvailableMb;

    @NonNull
    Duration pollingInterval;

    public MemoryPressureLevel pressureLevel(double availableMb) {
        if (availableMb < criticalAvailableMb) {
            return MemoryPressureLevel.CRITICAL;
        }
        if (availableMb < warningAvailableMb) {
            return MemoryPressureLevel.WARNING;
        }
        return MemoryPressureLevel.NORMAL;
    }
}
