package com.github.stormino.streamcore.broadcast;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fan-out of values to any number of listeners.
 * <p>
 * Listeners only see values broadcast after they registered; nothing is replayed.
 * A listener that throws is logged and does not prevent delivery to the others.
 *
 * @param <T> type of broadcast value
 */
@Slf4j
public class UpdateBroadcaster<T> {

    private final String name;
    private final CopyOnWriteArrayList<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public UpdateBroadcaster(@NonNull String name) {
        this.name = name;
    }

    /**
     * Register a listener for future values.
     *
     * @return handle that unregisters the listener
     */
    public Subscription subscribe(@NonNull Consumer<? super T> listener) {
        listeners.add(listener);
        log.debug("{} listener registered. Total: {}", name, listeners.size());
        return new ListenerSubscription(listener);
    }

    /**
     * Lazy sequence of future values, backed by its own subscription.
     */
    public UpdateStream<T> stream() {
        return new UpdateStream<>(this::subscribe);
    }

    public void broadcast(@NonNull T value) {
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (Exception e) {
                log.error("Error in {} listener: {}", name, e.getMessage(), e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    private final class ListenerSubscription implements Subscription {

        private final Consumer<? super T> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ListenerSubscription(Consumer<? super T> listener) {
            this.listener = listener;
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(listener);
                log.debug("{} listener unregistered. Remaining: {}", name, listeners.size());
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
