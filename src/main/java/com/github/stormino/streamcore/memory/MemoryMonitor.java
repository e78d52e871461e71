package com.github.stormino.streamcore.memory;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.broadcast.UpdateStream;
import com.github.stormino.streamcore.model.MemoryState;

import java.util.function.Consumer;

/**
 * Produces an ongoing sequence of memory snapshots and exposes the latest one.
 */
public interface MemoryMonitor {

    /**
     * Latest snapshot. Samples on demand if no snapshot has been captured yet.
     */
    MemoryState currentMemoryState();

    /**
     * Begin periodic sampling. No-op when already running.
     */
    void startMonitoring();

    /**
     * Halt sampling. Safe to call repeatedly or before {@link #startMonitoring()}.
     */
    void stopMonitoring();

    boolean isMonitoring();

    /**
     * Receive every snapshot emitted from now on.
     */
    Subscription subscribe(Consumer<? super MemoryState> listener);

    /**
     * Lazy sequence of snapshots emitted from now on.
     */
    UpdateStream<MemoryState> stateStream();
}
