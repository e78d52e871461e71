package com.github.stormino.streamcore.player;

/**
 * A playable item whose forward buffer can be tuned.
 */
public interface BufferConfigurableItem {

    void setPreferredForwardBufferSeconds(double seconds);
}
