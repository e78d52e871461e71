package com.github.stormino.streamcore.config;

import com.github.stormino.streamcore.model.BufferStrategy;
import com.github.stormino.streamcore.model.MemoryThresholds;
import com.github.stormino.streamcore.model.NetworkQuality;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "streamcore")
public class StreamCoreProperties {

    @Valid
    private Memory memory = new Memory();

    @Valid
    private Network network = new Network();

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Memory {
        @Positive
        private double warningAvailableMb = MemoryThresholds.DEFAULT.getWarningAvailableMb();

        @Positive
        private double criticalAvailableMb = MemoryThresholds.DEFAULT.getCriticalAvailableMb();

        @NotNull
        private Duration pollingInterval = MemoryThresholds.DEFAULT.getPollingInterval();

        @NotNull
        private SamplerType sampler = SamplerType.OSHI;

        @AssertTrue(message = "critical-available-mb must be below warning-available-mb")
        public boolean isThresholdOrderValid() {
            return criticalAvailableMb < warningAvailableMb;
        }

        @AssertTrue(message = "polling-interval must be positive")
        public boolean isPollingIntervalPositive() {
            return pollingInterval == null || (!pollingInterval.isNegative() && !pollingInterval.isZero());
        }

        public MemoryThresholds toThresholds() {
            return MemoryThresholds.builder()
                    .warningAvailableMb(warningAvailableMb)
                    .criticalAvailableMb(criticalAvailableMb)
                    .pollingInterval(pollingInterval)
                    .build();
        }
    }

    @Data
    public static class Network {
        /**
         * Overrides of the default network quality to buffer ceiling mapping.
         */
        private Map<NetworkQuality, BufferStrategy> ceilings = new EnumMap<>(NetworkQuality.class);
    }

    @Data
    public static class Cleanup {
        private boolean autoEnabled = true;
    }

    public enum SamplerType {
        OSHI,
        JVM_HEAP
    }
}
