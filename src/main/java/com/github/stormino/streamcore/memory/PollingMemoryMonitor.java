package com.github.stormino.streamcore.memory;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.broadcast.UpdateBroadcaster;
import com.github.stormino.streamcore.broadcast.UpdateStream;
import com.github.stormino.streamcore.model.MemoryPressureLevel;
import com.github.stormino.streamcore.model.MemoryState;
import com.github.stormino.streamcore.model.MemoryThresholds;
import com.github.stormino.streamcore.util.ByteUnits;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Memory monitor that polls a {@link MemorySampler} on a {@link TaskScheduler}.
 * <p>
 * Sampling happens on the scheduler's thread, never on the caller's. The
 * lifecycle lock only guards the scheduled task and is never held while
 * listeners run. Emissions take a separate emission lock, which
 * {@link #stopMonitoring()} acquires once after cancelling, so once stop
 * returns no further snapshot is published until monitoring is restarted.
 * A listener that stops the monitor from the sampling thread does not wait
 * for its own emission.
 * A sample that throws is logged and skipped; the loop keeps running.
 */
@Slf4j
public class PollingMemoryMonitor implements MemoryMonitor {

    private final MemorySampler sampler;
    private final MemoryThresholds thresholds;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final UpdateBroadcaster<MemoryState> broadcaster = new UpdateBroadcaster<>("memory-state");
    private final AtomicReference<MemoryState> latestState = new AtomicReference<>();
    private final Object lifecycleLock = new Object();
    private final ReentrantLock emissionLock = new ReentrantLock();

    private ScheduledFuture<?> pollingTask;
    private long generation;
    private MemoryPressureLevel lastLevel;

    public PollingMemoryMonitor(@NonNull MemorySampler sampler,
                                @NonNull MemoryThresholds thresholds,
                                @NonNull TaskScheduler scheduler,
                                @NonNull Clock clock) {
        this.sampler = sampler;
        this.thresholds = thresholds;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public MemoryState currentMemoryState() {
        MemoryState state = latestState.get();
        if (state != null) {
            return state;
        }
        return MemoryState.of(sampler.sample(), clock.instant());
    }

    @Override
    public void startMonitoring() {
        synchronized (lifecycleLock) {
            if (pollingTask != null) {
                return;
            }
            long runGeneration = ++generation;
            pollingTask = scheduler.scheduleWithFixedDelay(
                    () -> poll(runGeneration), thresholds.getPollingInterval());
            log.info("Memory monitoring started (sampler: {}, interval: {})",
                    sampler.getName(), thresholds.getPollingInterval());
        }
    }

    @Override
    public void stopMonitoring() {
        synchronized (lifecycleLock) {
            if (pollingTask == null) {
                return;
            }
            pollingTask.cancel(false);
            pollingTask = null;
        }
        // wait for an emission already past its generation check
        emissionLock.lock();
        emissionLock.unlock();
        log.info("Memory monitoring stopped");
    }

    @Override
    public boolean isMonitoring() {
        synchronized (lifecycleLock) {
            return pollingTask != null;
        }
    }

    @Override
    public Subscription subscribe(@NonNull Consumer<? super MemoryState> listener) {
        return broadcaster.subscribe(listener);
    }

    @Override
    public UpdateStream<MemoryState> stateStream() {
        return broadcaster.stream();
    }

    private void poll(long runGeneration) {
        MemoryState state;
        try {
            state = MemoryState.of(sampler.sample(), clock.instant());
        } catch (RuntimeException e) {
            // an exception escaping a fixed-delay task would cancel every later tick
            log.warn("Memory sample from {} failed, skipping tick: {}", sampler.getName(), e.getMessage());
            return;
        }

        emissionLock.lock();
        try {
            if (!isCurrentRun(runGeneration)) {
                return;
            }
            latestState.set(state);
            logSample(state);
            broadcaster.broadcast(state);
        } finally {
            emissionLock.unlock();
        }
    }

    private boolean isCurrentRun(long runGeneration) {
        synchronized (lifecycleLock) {
            return pollingTask != null && runGeneration == generation;
        }
    }

    private void logSample(MemoryState state) {
        MemoryPressureLevel level = state.pressureLevel(thresholds);
        if (level != lastLevel) {
            log.info("Memory pressure {} -> {} ({} available, {} used)",
                    lastLevel, level,
                    ByteUnits.formatSize(state.getAvailableBytes()),
                    String.format("%.1f%%", state.getUsagePercentage()));
            lastLevel = level;
        } else {
            log.debug("Memory sample: {} available of {}",
                    ByteUnits.formatSize(state.getAvailableBytes()),
                    ByteUnits.formatSize(state.getTotalBytes()));
        }
    }
}
