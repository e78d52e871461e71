package com.github.stormino.streamcore.broadcast;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, blocking sequence of values delivered after the stream was opened.
 * <p>
 * Each stream holds its own subscription and its own queue, so every consumer
 * sees every future value independently. Iteration blocks until a value
 * arrives and ends once the stream is closed and drained. A stream is meant
 * for a single consuming thread.
 * <p>
 * An open stream keeps its subscription until {@link #close()} is called, so
 * callers must close it (try-with-resources, or {@link Stream#close()} on the
 * {@link #stream()} view). At most {@value #DEFAULT_CAPACITY} unread values are
 * buffered by default; when a slow reader falls further behind, the oldest
 * unread values are dropped.
 *
 * @param <T> type of element
 */
@Slf4j
public class UpdateStream<T> implements Iterator<T>, AutoCloseable {

    public static final int DEFAULT_CAPACITY = 256;

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue;
    private final Subscription subscription;
    private volatile boolean closed;
    private Object pending;
    private long dropped;

    UpdateStream(@NonNull Function<Consumer<T>, Subscription> subscriber) {
        this(subscriber, DEFAULT_CAPACITY);
    }

    UpdateStream(@NonNull Function<Consumer<T>, Subscription> subscriber, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Stream capacity must be positive: " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.subscription = subscriber.apply(this::enqueue);
    }

    /**
     * Block until the next value arrives or the stream is closed.
     */
    @Override
    public boolean hasNext() {
        if (pending == null) {
            try {
                pending = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        if (pending == END) {
            // keep the marker for any later hasNext() call
            queue.offer(END);
            pending = null;
            return false;
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Update stream is closed");
        }
        T value = cast(pending);
        pending = null;
        return value;
    }

    /**
     * Wait up to {@code timeout} for the next value.
     *
     * @return the value, or empty on timeout or once closed
     */
    public Optional<T> poll(@NonNull Duration timeout) throws InterruptedException {
        Object value = pending != null ? pending : queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        pending = null;
        if (value == null) {
            return Optional.empty();
        }
        if (value == END) {
            queue.offer(END);
            return Optional.empty();
        }
        return Optional.of(cast(value));
    }

    /**
     * Sequential blocking {@link Stream} view; terminal operations wait for values.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Number of unread values discarded because the reader fell behind.
     */
    public synchronized long getDroppedCount() {
        return dropped;
    }

    /**
     * Stop receiving values. Already queued values can still be read.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            offerDroppingOldest(END);
        }
        subscription.cancel();
    }

    private synchronized void enqueue(T value) {
        if (!closed) {
            offerDroppingOldest(value);
        }
    }

    // caller holds this stream's monitor
    private void offerDroppingOldest(Object value) {
        while (!queue.offer(value)) {
            if (queue.poll() != null) {
                dropped++;
                log.debug("Update stream full, dropped oldest unread value ({} dropped so far)", dropped);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private T cast(Object value) {
        return (T) value;
    }
}
