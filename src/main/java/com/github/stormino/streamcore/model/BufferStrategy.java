package com.github.stormino.streamcore.model;

/**
 * Discrete buffering policies, totally ordered by rank from the most
 * conservative to the most generous.
 */
public enum BufferStrategy {
    MINIMAL(0, "minimal"),
    CONSERVATIVE(1, "conservative"),
    BALANCED(2, "balanced"),
    AGGRESSIVE(3, "aggressive");

    private final int rank;
    private final String label;

    BufferStrategy(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Lower-case name used when composing configuration reasons.
     */
    public String getLabel() {
        return label;
    }

    public boolean isMoreConservativeThan(BufferStrategy other) {
        return rank < other.rank;
    }

    /**
     * The more conservative of two strategies. Ties return {@code first}.
     */
    public static BufferStrategy min(BufferStrategy first, BufferStrategy second) {
        return second.isMoreConservativeThan(first) ? second : first;
    }

    public static BufferStrategy fromRank(int rank) {
        for (BufferStrategy strategy : values()) {
            if (strategy.rank == rank) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown buffer strategy rank: " + rank);
    }
}
