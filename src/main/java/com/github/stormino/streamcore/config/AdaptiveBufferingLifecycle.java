package com.github.stormino.streamcore.config;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.buffer.BufferManager;
import com.github.stormino.streamcore.cleanup.ResourceCleanupCoordinator;
import com.github.stormino.streamcore.memory.MemoryMonitor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Feeds memory snapshots into the buffer manager for as long as the
 * application runs, and stops the sampling loop at shutdown.
 */
@Slf4j
public class AdaptiveBufferingLifecycle implements SmartLifecycle {

    private final MemoryMonitor memoryMonitor;
    private final BufferManager bufferManager;
    private final ResourceCleanupCoordinator cleanupCoordinator;
    private final boolean autoCleanup;

    private final Object transitionLock = new Object();
    private volatile Subscription memoryFeed;

    public AdaptiveBufferingLifecycle(@NonNull MemoryMonitor memoryMonitor,
                                      @NonNull BufferManager bufferManager,
                                      @NonNull ResourceCleanupCoordinator cleanupCoordinator,
                                      boolean autoCleanup) {
        this.memoryMonitor = memoryMonitor;
        this.bufferManager = bufferManager;
        this.cleanupCoordinator = cleanupCoordinator;
        this.autoCleanup = autoCleanup;
    }

    @Override
    public void start() {
        synchronized (transitionLock) {
            if (memoryFeed != null) {
                return;
            }
            memoryFeed = memoryMonitor.subscribe(bufferManager::updateMemoryState);
            if (autoCleanup) {
                cleanupCoordinator.enableAutoCleanup();
            }
            memoryMonitor.startMonitoring();
        }
        log.info("Adaptive buffering started with {}", bufferManager.getCurrentConfiguration().getStrategy());
    }

    @Override
    public void stop() {
        synchronized (transitionLock) {
            Subscription feed = memoryFeed;
            if (feed == null) {
                return;
            }
            memoryMonitor.stopMonitoring();
            cleanupCoordinator.disableAutoCleanup();
            feed.cancel();
            memoryFeed = null;
        }
        log.info("Adaptive buffering stopped");
    }

    // lock-free; listeners may call it while stop() waits for their emission
    @Override
    public boolean isRunning() {
        return memoryFeed != null;
    }
}
