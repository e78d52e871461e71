package com.github.stormino.streamcore.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoryThresholds")
class MemoryThresholdsTest {

    @Nested
    @DisplayName("defaults")
    class DefaultTests {

        @Test
        @DisplayName("should warn below 100 MB and go critical below 50 MB")
        void shouldUseDocumentedDefaults() {
            assertEquals(100.0, MemoryThresholds.DEFAULT.getWarningAvailableMb());
            assertEquals(50.0, MemoryThresholds.DEFAULT.getCriticalAvailableMb());
            assertEquals(Duration.ofSeconds(2), MemoryThresholds.DEFAULT.getPollingInterval());
        }

        @ParameterizedTest(name = "{0} MB available -> {1}")
        @CsvSource({
                "0, CRITICAL",
                "49, CRITICAL",
                "49.99, CRITICAL",
                "50, WARNING",
                "75, WARNING",
                "99.99, WARNING",
                "100, NORMAL",
                "150, NORMAL",
                "8192, NORMAL"
        })
        @DisplayName("should classify available memory")
        void shouldClassifyAvailableMemory(double availableMb, MemoryPressureLevel expected) {
            assertEquals(expected, MemoryThresholds.DEFAULT.pressureLevel(availableMb));
        }
    }

    @Nested
    @DisplayName("custom thresholds")
    class CustomThresholdTests {

        private final MemoryThresholds thresholds = MemoryThresholds.builder()
                .warningAvailableMb(512)
                .criticalAvailableMb(256)
                .pollingInterval(Duration.ofMillis(500))
                .build();

        @Test
        @DisplayName("should treat the critical bound itself as warning")
        void criticalBoundIsWarning() {
            assertEquals(MemoryPressureLevel.WARNING, thresholds.pressureLevel(256));
        }

        @Test
        @DisplayName("should treat the warning bound itself as normal")
        void warningBoundIsNormal() {
            assertEquals(MemoryPressureLevel.NORMAL, thresholds.pressureLevel(512));
        }

        @Test
        @DisplayName("should be equal when built from the same values")
        void shouldHaveValueEquality() {
            MemoryThresholds same = MemoryThresholds.builder()
                    .warningAvailableMb(512)
                    .criticalAvailableMb(256)
                    .pollingInterval(Duration.ofMillis(500))
                    .build();
            assertEquals(thresholds, same);
            assertNotEquals(MemoryThresholds.DEFAULT, thresholds);
        }

        @Test
        @DisplayName("should reject a missing polling interval")
        void shouldRejectMissingPollingInterval() {
            assertThrows(NullPointerException.class, () -> MemoryThresholds.builder()
                    .warningAvailableMb(100)
                    .criticalAvailableMb(50)
                    .build());
        }
    }
}
