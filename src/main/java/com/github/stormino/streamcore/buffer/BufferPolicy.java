package com.github.stormino.streamcore.buffer;

import com.github.stormino.streamcore.model.BufferConfiguration;
import com.github.stormino.streamcore.model.BufferStrategy;
import com.github.stormino.streamcore.model.MemoryPressureLevel;
import com.github.stormino.streamcore.model.NetworkQuality;
import lombok.NonNull;

/**
 * Combines memory pressure and network quality into a buffer configuration.
 * <p>
 * Each input yields a strategy ceiling and the result is the lower of the two,
 * so buffering is exactly as generous as the most constrained resource allows.
 * When memory is binding (including ties) the canonical preset is returned;
 * when the network is binding the preset carries a network reason instead.
 */
public class BufferPolicy {

    private final NetworkCeilingPolicy networkCeilings;

    public BufferPolicy(@NonNull NetworkCeilingPolicy networkCeilings) {
        this.networkCeilings = networkCeilings;
    }

    public BufferConfiguration decide(@NonNull MemoryPressureLevel memoryPressure,
                                      @NonNull NetworkQuality networkQuality) {
        BufferStrategy memoryCeiling = memoryPressure.getCeiling();
        BufferStrategy networkCeiling = networkCeilings.ceilingFor(networkQuality);

        if (!networkCeiling.isMoreConservativeThan(memoryCeiling)) {
            return BufferConfiguration.presetFor(memoryCeiling);
        }
        return BufferConfiguration.presetFor(networkCeiling)
                .withReason(networkReason(networkQuality, networkCeiling));
    }

    static String networkReason(NetworkQuality quality, BufferStrategy strategy) {
        return quality.getDisplayName() + " - " + strategy.getLabel() + " buffering";
    }
}
