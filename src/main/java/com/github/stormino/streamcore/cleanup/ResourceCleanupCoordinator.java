package com.github.stormino.streamcore.cleanup;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.broadcast.UpdateBroadcaster;
import com.github.stormino.streamcore.memory.MemoryMonitor;
import com.github.stormino.streamcore.model.CleanupPriority;
import com.github.stormino.streamcore.model.CleanupResult;
import com.github.stormino.streamcore.model.MemoryPressureLevel;
import com.github.stormino.streamcore.model.MemoryState;
import com.github.stormino.streamcore.model.MemoryThresholds;
import com.github.stormino.streamcore.util.ByteUnits;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Releases registered resources when memory pressure rises.
 * <p>
 * Cleaners run highest priority first. With auto cleanup enabled, a critical
 * snapshot clears everything and a warning snapshot clears {@link CleanupPriority#LOW}
 * and {@link CleanupPriority#MEDIUM} resources. The coordinator listens to the
 * monitor but leaves starting and stopping it to its owner.
 */
@Slf4j
public class ResourceCleanupCoordinator {

    private static final Comparator<ResourceCleaner> HIGHEST_PRIORITY_FIRST =
            Comparator.comparing(ResourceCleaner::getPriority).reversed();

    private final MemoryMonitor memoryMonitor;
    private final MemoryThresholds thresholds;
    private final List<ResourceCleaner> cleaners = new ArrayList<>();
    private final UpdateBroadcaster<List<CleanupResult>> broadcaster = new UpdateBroadcaster<>("cleanup-results");

    private Subscription monitorSubscription;

    public ResourceCleanupCoordinator(@NonNull Collection<? extends ResourceCleaner> cleaners,
                                      @NonNull MemoryMonitor memoryMonitor,
                                      @NonNull MemoryThresholds thresholds) {
        this.memoryMonitor = memoryMonitor;
        this.thresholds = thresholds;
        this.cleaners.addAll(cleaners);
        this.cleaners.sort(HIGHEST_PRIORITY_FIRST);
    }

    public synchronized void register(@NonNull ResourceCleaner cleaner) {
        cleaners.add(cleaner);
        cleaners.sort(HIGHEST_PRIORITY_FIRST);
        log.info("Registered cleaner '{}' ({})", cleaner.getResourceName(), cleaner.getPriority());
    }

    public synchronized List<ResourceCleaner> getCleaners() {
        return List.copyOf(cleaners);
    }

    /**
     * Clean every registered resource, highest priority first.
     */
    public List<CleanupResult> cleanupAll() {
        return runCleaners(getCleaners());
    }

    /**
     * Clean resources whose priority is at most {@code bound}.
     */
    public List<CleanupResult> cleanupUpTo(@NonNull CleanupPriority bound) {
        List<ResourceCleaner> selected = new ArrayList<>();
        for (ResourceCleaner cleaner : getCleaners()) {
            if (cleaner.getPriority().isAtMost(bound)) {
                selected.add(cleaner);
            }
        }
        return runCleaners(selected);
    }

    public long estimateTotalCleanup() {
        long total = 0L;
        for (ResourceCleaner cleaner : getCleaners()) {
            total += cleaner.estimateCleanup();
        }
        return total;
    }

    public synchronized void enableAutoCleanup() {
        if (monitorSubscription != null) {
            return;
        }
        monitorSubscription = memoryMonitor.subscribe(this::onMemoryState);
        log.info("Automatic resource cleanup enabled for {} cleaners", cleaners.size());
    }

    public synchronized void disableAutoCleanup() {
        if (monitorSubscription == null) {
            return;
        }
        monitorSubscription.cancel();
        monitorSubscription = null;
        log.info("Automatic resource cleanup disabled");
    }

    public synchronized boolean isAutoCleanupEnabled() {
        return monitorSubscription != null;
    }

    /**
     * Receive every batch of results produced by automatic cleanup.
     */
    public Subscription subscribe(@NonNull Consumer<? super List<CleanupResult>> listener) {
        return broadcaster.subscribe(listener);
    }

    void onMemoryState(MemoryState state) {
        MemoryPressureLevel level = state.pressureLevel(thresholds);
        List<CleanupResult> results;
        switch (level) {
            case CRITICAL:
                results = cleanupAll();
                break;
            case WARNING:
                results = cleanupUpTo(CleanupPriority.MEDIUM);
                break;
            default:
                return;
        }

        if (!results.isEmpty()) {
            long freed = results.stream().mapToLong(CleanupResult::getBytesFreed).sum();
            log.info("Memory {}: cleaned {} resources, freed {}",
                    level, results.size(), ByteUnits.formatSize(freed));
            broadcaster.broadcast(List.copyOf(results));
        }
    }

    private List<CleanupResult> runCleaners(List<ResourceCleaner> selected) {
        List<CleanupResult> results = new ArrayList<>(selected.size());
        for (ResourceCleaner cleaner : selected) {
            CleanupResult result = cleaner.cleanup();
            if (!result.isSuccess()) {
                log.warn("Cleanup of '{}' failed: {}", result.getResourceName(), result.getError());
            }
            results.add(result);
        }
        return results;
    }
}
