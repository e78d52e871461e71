package com.github.stormino.streamcore.player;

/**
 * A player exposing the item it is currently playing.
 *
 * @param <I> item type
 */
public interface BufferConfigurablePlayer<I extends BufferConfigurableItem> {

    /**
     * @return the current item, or null when nothing is loaded
     */
    I getCurrentItem();
}
