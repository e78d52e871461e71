package com.github.stormino.streamcore.model;

/**
 * Ordered network quality classification supplied by the network sampler.
 */
public enum NetworkQuality {
    OFFLINE("Offline"),
    POOR("Poor network"),
    FAIR("Fair network"),
    GOOD("Good network"),
    EXCELLENT("Excellent network");

    private final String displayName;

    NetworkQuality(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
