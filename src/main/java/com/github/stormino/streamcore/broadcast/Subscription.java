package com.github.stormino.streamcore.broadcast;

/**
 * Handle returned when registering a listener. Cancelling is idempotent.
 */
public interface Subscription extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
