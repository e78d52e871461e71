package com.github.stormino.streamcore.buffer;

import com.github.stormino.streamcore.exception.ConfigurationException;
import com.github.stormino.streamcore.model.BufferStrategy;
import com.github.stormino.streamcore.model.NetworkQuality;
import lombok.NonNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each {@link NetworkQuality} to the most generous {@link BufferStrategy} it permits.
 * <p>
 * Every quality must be mapped, and a better network never gets a lower ceiling.
 * Default mapping:
 * <pre>
 * OFFLINE, POOR → MINIMAL
 * FAIR          → CONSERVATIVE
 * GOOD          → BALANCED
 * EXCELLENT     → AGGRESSIVE
 * </pre>
 */
public final class NetworkCeilingPolicy {

    private static final String CONFIG_KEY = "streamcore.network.ceilings";

    private final Map<NetworkQuality, BufferStrategy> ceilings;

    private NetworkCeilingPolicy(Map<NetworkQuality, BufferStrategy> ceilings) {
        this.ceilings = Collections.unmodifiableMap(ceilings);
    }

    public static NetworkCeilingPolicy defaults() {
        return of(defaultCeilings());
    }

    /**
     * Default mapping with some qualities overridden.
     */
    public static NetworkCeilingPolicy withOverrides(@NonNull Map<NetworkQuality, BufferStrategy> overrides) {
        Map<NetworkQuality, BufferStrategy> merged = defaultCeilings();
        merged.putAll(overrides);
        return of(merged);
    }

    /**
     * Policy from a complete mapping.
     *
     * @throws ConfigurationException if a quality is unmapped or the mapping is not monotonic
     */
    public static NetworkCeilingPolicy of(@NonNull Map<NetworkQuality, BufferStrategy> mapping) {
        EnumMap<NetworkQuality, BufferStrategy> ceilings = new EnumMap<>(NetworkQuality.class);
        BufferStrategy previous = null;
        for (NetworkQuality quality : NetworkQuality.values()) {
            BufferStrategy ceiling = mapping.get(quality);
            if (ceiling == null) {
                throw new ConfigurationException(
                        "No buffer ceiling configured for network quality " + quality,
                        CONFIG_KEY + "." + quality);
            }
            if (previous != null && ceiling.isMoreConservativeThan(previous)) {
                throw new ConfigurationException(
                        String.format("Network quality %s has ceiling %s, below the %s allowed for a worse network",
                                quality, ceiling, previous),
                        CONFIG_KEY + "." + quality, ceiling.name());
            }
            ceilings.put(quality, ceiling);
            previous = ceiling;
        }
        return new NetworkCeilingPolicy(ceilings);
    }

    public BufferStrategy ceilingFor(@NonNull NetworkQuality quality) {
        return ceilings.get(quality);
    }

    public Map<NetworkQuality, BufferStrategy> asMap() {
        return ceilings;
    }

    private static Map<NetworkQuality, BufferStrategy> defaultCeilings() {
        EnumMap<NetworkQuality, BufferStrategy> defaults = new EnumMap<>(NetworkQuality.class);
        defaults.put(NetworkQuality.OFFLINE, BufferStrategy.MINIMAL);
        defaults.put(NetworkQuality.POOR, BufferStrategy.MINIMAL);
        defaults.put(NetworkQuality.FAIR, BufferStrategy.CONSERVATIVE);
        defaults.put(NetworkQuality.GOOD, BufferStrategy.BALANCED);
        defaults.put(NetworkQuality.EXCELLENT, BufferStrategy.AGGRESSIVE);
        return defaults;
    }

    @Override
    public String toString() {
        return "NetworkCeilingPolicy" + ceilings;
    }
}
