package com.github.stormino.streamcore.config;

import com.github.stormino.streamcore.buffer.AdaptiveBufferManager;
import com.github.stormino.streamcore.buffer.BufferPolicy;
import com.github.stormino.streamcore.buffer.NetworkCeilingPolicy;
import com.github.stormino.streamcore.cleanup.ResourceCleaner;
import com.github.stormino.streamcore.cleanup.ResourceCleanupCoordinator;
import com.github.stormino.streamcore.memory.JvmHeapMemorySampler;
import com.github.stormino.streamcore.memory.MemorySampler;
import com.github.stormino.streamcore.memory.OshiMemorySampler;
import com.github.stormino.streamcore.memory.PollingMemoryMonitor;
import com.github.stormino.streamcore.model.MemoryThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(StreamCoreProperties.class)
public class StreamCoreConfig {

    private final StreamCoreProperties properties;

    @Bean(name = "memoryScheduler")
    public ThreadPoolTaskScheduler memoryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // one thread keeps samples from the same monitor strictly ordered
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("memory-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock streamCoreClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MemoryThresholds memoryThresholds() {
        return properties.getMemory().toThresholds();
    }

    @Bean
    public MemorySampler memorySampler() {
        StreamCoreProperties.SamplerType type = properties.getMemory().getSampler();
        log.info("Using {} memory sampler", type);
        switch (type) {
            case JVM_HEAP:
                return new JvmHeapMemorySampler();
            case OSHI:
            default:
                return new OshiMemorySampler();
        }
    }

    @Bean
    public NetworkCeilingPolicy networkCeilingPolicy() {
        NetworkCeilingPolicy policy = NetworkCeilingPolicy.withOverrides(properties.getNetwork().getCeilings());
        log.info("Network buffer ceilings: {}", policy.asMap());
        return policy;
    }

    @Bean
    public PollingMemoryMonitor memoryMonitor(MemorySampler memorySampler,
                                              MemoryThresholds memoryThresholds,
                                              @Qualifier("memoryScheduler") ThreadPoolTaskScheduler memoryScheduler,
                                              Clock streamCoreClock) {
        return new PollingMemoryMonitor(memorySampler, memoryThresholds, memoryScheduler, streamCoreClock);
    }

    @Bean
    public AdaptiveBufferManager bufferManager(MemoryThresholds memoryThresholds,
                                               NetworkCeilingPolicy networkCeilingPolicy) {
        return new AdaptiveBufferManager(memoryThresholds, new BufferPolicy(networkCeilingPolicy));
    }

    @Bean
    public ResourceCleanupCoordinator resourceCleanupCoordinator(ObjectProvider<ResourceCleaner> cleaners,
                                                                 PollingMemoryMonitor memoryMonitor,
                                                                 MemoryThresholds memoryThresholds) {
        return new ResourceCleanupCoordinator(cleaners.orderedStream().toList(), memoryMonitor, memoryThresholds);
    }

    @Bean
    public AdaptiveBufferingLifecycle adaptiveBufferingLifecycle(PollingMemoryMonitor memoryMonitor,
                                                                 AdaptiveBufferManager bufferManager,
                                                                 ResourceCleanupCoordinator resourceCleanupCoordinator) {
        return new AdaptiveBufferingLifecycle(memoryMonitor, bufferManager, resourceCleanupCoordinator,
                properties.getCleanup().isAutoEnabled());
    }
}
