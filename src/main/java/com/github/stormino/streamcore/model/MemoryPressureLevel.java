package com.github.stormino.streamcore.model;

/**
 * Coarse classification of available memory, ordered from least to most severe.
 */
public enum MemoryPressureLevel {
    NORMAL(BufferStrategy.AGGRESSIVE),
    WARNING(BufferStrategy.CONSERVATIVE),
    CRITICAL(BufferStrategy.MINIMAL);

    private final BufferStrategy ceiling;

    MemoryPressureLevel(BufferStrategy ceiling) {
        this.ceiling = ceiling;
    }

    /**
     * Most generous buffering strategy this pressure level permits.
     */
    public BufferStrategy getCeiling() {
        return ceiling;
    }
}
