package com.github.stormino.streamcore.player;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.buffer.BufferManager;
import com.github.stormino.streamcore.model.BufferConfiguration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies buffer configuration changes to a player's current item.
 * <p>
 * Items loaded later should go through {@link #applyToNewItem} so they start
 * with the configuration that is current at that moment.
 *
 * @param <I> item type
 */
@Slf4j
public class PlayerBufferAdapter<I extends BufferConfigurableItem> implements AutoCloseable {

    private final BufferConfigurablePlayer<I> player;
    private final BufferManager bufferManager;
    private final Subscription subscription;

    public PlayerBufferAdapter(@NonNull BufferConfigurablePlayer<I> player, @NonNull BufferManager bufferManager) {
        this(player, bufferManager, true);
    }

    public PlayerBufferAdapter(@NonNull BufferConfigurablePlayer<I> player,
                               @NonNull BufferManager bufferManager,
                               boolean observeChanges) {
        this.player = player;
        this.bufferManager = bufferManager;
        this.subscription = observeChanges ? bufferManager.subscribe(this::applyConfiguration) : null;
    }

    public BufferConfigurablePlayer<I> getPlayer() {
        return player;
    }

    /**
     * Apply the current configuration to an item about to replace the current one.
     */
    public void applyToNewItem(@NonNull I item) {
        BufferConfiguration config = bufferManager.getCurrentConfiguration();
        item.setPreferredForwardBufferSeconds(config.getPreferredForwardBufferSeconds());
    }

    public boolean isObserving() {
        return subscription != null && subscription.isActive();
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    private void applyConfiguration(BufferConfiguration configuration) {
        I item = player.getCurrentItem();
        if (item == null) {
            log.debug("No current item, skipping buffer configuration {}", configuration.getStrategy());
            return;
        }
        item.setPreferredForwardBufferSeconds(configuration.getPreferredForwardBufferSeconds());
    }
}
