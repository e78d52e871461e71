package com.github.stormino.streamcore.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BufferConfiguration")
class BufferConfigurationTest {

    @Nested
    @DisplayName("presets")
    class PresetTests {

        @ParameterizedTest(name = "{0} buffers {1}s ahead")
        @CsvSource({
                "MINIMAL, 2.0",
                "CONSERVATIVE, 5.0",
                "BALANCED, 10.0",
                "AGGRESSIVE, 30.0"
        })
        @DisplayName("should use fixed forward-buffer durations")
        void shouldUseFixedDurations(BufferStrategy strategy, double seconds) {
            BufferConfiguration preset = BufferConfiguration.presetFor(strategy);

            assertEquals(strategy, preset.getStrategy());
            assertEquals(seconds, preset.getPreferredForwardBufferSeconds());
        }

        @Test
        @DisplayName("should carry human-readable reasons")
        void shouldCarryReasons() {
            assertEquals("Memory critical - minimal buffering", BufferConfiguration.MINIMAL.getReason());
            assertEquals("Limited resources - conservative buffering", BufferConfiguration.CONSERVATIVE.getReason());
            assertEquals("Normal conditions - balanced buffering", BufferConfiguration.BALANCED.getReason());
            assertEquals("Optimal conditions - aggressive buffering", BufferConfiguration.AGGRESSIVE.getReason());
        }

        @ParameterizedTest
        @EnumSource(BufferStrategy.class)
        @DisplayName("presetFor should return the shared constant")
        void presetForShouldReturnConstant(BufferStrategy strategy) {
            assertSame(BufferConfiguration.presetFor(strategy), BufferConfiguration.presetFor(strategy));
        }
    }

    @Nested
    @DisplayName("withReason")
    class WithReasonTests {

        @Test
        @DisplayName("should keep strategy and duration")
        void shouldKeepStrategyAndDuration() {
            BufferConfiguration config = BufferConfiguration.MINIMAL.withReason("Poor network - minimal buffering");

            assertEquals(BufferStrategy.MINIMAL, config.getStrategy());
            assertEquals(2.0, config.getPreferredForwardBufferSeconds());
            assertEquals("Poor network - minimal buffering", config.getReason());
            assertNotEquals(BufferConfiguration.MINIMAL, config);
        }

        @Test
        @DisplayName("should return the same instance when the reason is unchanged")
        void shouldReturnSameInstanceForSameReason() {
            assertSame(BufferConfiguration.BALANCED,
                    BufferConfiguration.BALANCED.withReason(BufferConfiguration.BALANCED.getReason()));
        }

        @Test
        @DisplayName("should compare by value")
        void shouldCompareByValue() {
            BufferConfiguration copy = new BufferConfiguration(BufferStrategy.BALANCED, 10.0,
                    "Normal conditions - balanced buffering");

            assertEquals(BufferConfiguration.BALANCED, copy);
            assertEquals(BufferConfiguration.BALANCED.hashCode(), copy.hashCode());
        }
    }
}
