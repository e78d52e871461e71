package com.github.stormino.streamcore.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Immutable buffering decision: a strategy, its forward-buffer duration and
 * a human-readable reason. A new instance is produced on every recomputation.
 */
@Value
public class BufferConfiguration {

    public static final BufferConfiguration MINIMAL = new BufferConfiguration(
            BufferStrategy.MINIMAL, 2.0, "Memory critical - minimal buffering");

    public static final BufferConfiguration CONSERVATIVE = new BufferConfiguration(
            BufferStrategy.CONSERVATIVE, 5.0, "Limited resources - conservative buffering");

    public static final BufferConfiguration BALANCED = new BufferConfiguration(
            BufferStrategy.BALANCED, 10.0, "Normal conditions - balanced buffering");

    public static final BufferConfiguration AGGRESSIVE = new BufferConfiguration(
            BufferStrategy.AGGRESSIVE, 30.0, "Optimal conditions - aggressive buffering");

    @NonNull
    BufferStrategy strategy;

    double preferredForwardBufferSeconds;

    @NonNull
    String reason;

    /**
     * Canonical preset for a strategy.
     */
    public static BufferConfiguration presetFor(@NonNull BufferStrategy strategy) {
        switch (strategy) {
            case MINIMAL:
                return MINIMAL;
            case CONSERVATIVE:
                return CONSERVATIVE;
            case BALANCED:
                return BALANCED;
            case AGGRESSIVE:
                return AGGRESSIVE;
            default:
                throw new IllegalArgumentException("Unknown buffer strategy: " + strategy);
        }
    }

    /**
     * Same strategy and duration with a different justification.
     */
    public BufferConfiguration withReason(@NonNull String newReason) {
        if (newReason.equals(reason)) {
            return this;
        }
        return new BufferConfiguration(strategy, preferredForwardBufferSeconds, newReason);
    }
}
