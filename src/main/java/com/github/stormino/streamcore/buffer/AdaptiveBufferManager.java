package com.github.stormino.streamcore.buffer;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.broadcast.UpdateBroadcaster;
import com.github.stormino.streamcore.broadcast.UpdateStream;
import com.github.stormino.streamcore.model.BufferConfiguration;
import com.github.stormino.streamcore.model.MemoryPressureLevel;
import com.github.stormino.streamcore.model.MemoryState;
import com.github.stormino.streamcore.model.MemoryThresholds;
import com.github.stormino.streamcore.model.NetworkQuality;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Buffer manager fusing memory pressure and network quality.
 * <p>
 * Both update paths run "store input, recompute, replace" under one lock, so
 * concurrent memory and network updates always leave a configuration computed
 * from both latest inputs. Changes are queued under that lock and delivered
 * after it is released, one thread at a time, so listeners observe them in
 * decision order and may call back into other components without holding
 * this manager's lock. Reads of the current configuration do not take the lock.
 * <p>
 * Starts from the decision for normal memory pressure and a good network
 * (balanced buffering under the default ceilings) until the first update arrives.
 */
@Slf4j
public class AdaptiveBufferManager implements BufferManager {

    private final MemoryThresholds thresholds;
    private final BufferPolicy policy;
    private final UpdateBroadcaster<BufferConfiguration> broadcaster = new UpdateBroadcaster<>("buffer-configuration");
    private final ReentrantLock recomputeLock = new ReentrantLock();

    private MemoryPressureLevel memoryPressure = MemoryPressureLevel.NORMAL;
    private NetworkQuality networkQuality = NetworkQuality.GOOD;
    private volatile BufferConfiguration currentConfiguration;

    // guarded by recomputeLock
    private final Queue<BufferConfiguration> pendingBroadcasts = new ArrayDeque<>();
    private boolean publishing;

    public AdaptiveBufferManager(@NonNull MemoryThresholds thresholds, @NonNull BufferPolicy policy) {
        this.thresholds = thresholds;
        this.policy = policy;
        this.currentConfiguration = policy.decide(memoryPressure, networkQuality);
    }

    public AdaptiveBufferManager() {
        this(MemoryThresholds.DEFAULT, new BufferPolicy(NetworkCeilingPolicy.defaults()));
    }

    @Override
    public void updateMemoryState(@NonNull MemoryState state) {
        MemoryPressureLevel level = state.pressureLevel(thresholds);
        recomputeLock.lock();
        try {
            memoryPressure = level;
            recalculate();
        } finally {
            recomputeLock.unlock();
        }
        publishPending();
    }

    @Override
    public void updateNetworkQuality(@NonNull NetworkQuality quality) {
        recomputeLock.lock();
        try {
            networkQuality = quality;
            recalculate();
        } finally {
            recomputeLock.unlock();
        }
        publishPending();
    }

    @Override
    public BufferConfiguration getCurrentConfiguration() {
        return currentConfiguration;
    }

    public MemoryPressureLevel getMemoryPressure() {
        recomputeLock.lock();
        try {
            return memoryPressure;
        } finally {
            recomputeLock.unlock();
        }
    }

    public NetworkQuality getNetworkQuality() {
        recomputeLock.lock();
        try {
            return networkQuality;
        } finally {
            recomputeLock.unlock();
        }
    }

    @Override
    public Subscription subscribe(@NonNull Consumer<? super BufferConfiguration> listener) {
        return broadcaster.subscribe(listener);
    }

    @Override
    public UpdateStream<BufferConfiguration> configurationStream() {
        return broadcaster.stream();
    }

    // caller holds recomputeLock
    private void recalculate() {
        BufferConfiguration next = policy.decide(memoryPressure, networkQuality);
        if (next.equals(currentConfiguration)) {
            log.debug("Buffer configuration unchanged: {} (memory {}, network {})",
                    next.getStrategy(), memoryPressure, networkQuality);
            return;
        }

        BufferConfiguration previous = currentConfiguration;
        currentConfiguration = next;
        log.info("Buffer strategy {} -> {} ({}s forward): {}",
                previous.getStrategy(), next.getStrategy(),
                next.getPreferredForwardBufferSeconds(), next.getReason());
        pendingBroadcasts.add(next);
    }

    /**
     * Deliver queued changes unless another thread is already delivering;
     * that thread picks up whatever was queued meanwhile.
     */
    private void publishPending() {
        recomputeLock.lock();
        try {
            if (publishing || pendingBroadcasts.isEmpty()) {
                return;
            }
            publishing = true;
        } finally {
            recomputeLock.unlock();
        }

        boolean drained = false;
        try {
            for (BufferConfiguration next = nextPending(); next != null; next = nextPending()) {
                broadcaster.broadcast(next);
            }
            drained = true;
        } finally {
            if (!drained) {
                recomputeLock.lock();
                try {
                    publishing = false;
                } finally {
                    recomputeLock.unlock();
                }
            }
        }
    }

    // clears the publishing flag once the queue is empty
    private BufferConfiguration nextPending() {
        recomputeLock.lock();
        try {
            BufferConfiguration next = pendingBroadcasts.poll();
            if (next == null) {
                publishing = false;
            }
            return next;
        } finally {
            recomputeLock.unlock();
        }
    }
}
