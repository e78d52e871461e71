package com.github.stormino.streamcore.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BufferStrategy")
class BufferStrategyTest {

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("should rank strategies from minimal to aggressive")
        void shouldRankStrategies() {
            assertEquals(0, BufferStrategy.MINIMAL.getRank());
            assertEquals(1, BufferStrategy.CONSERVATIVE.getRank());
            assertEquals(2, BufferStrategy.BALANCED.getRank());
            assertEquals(3, BufferStrategy.AGGRESSIVE.getRank());
        }

        @Test
        @DisplayName("minimal should be more conservative than aggressive")
        void minimalIsMoreConservativeThanAggressive() {
            assertTrue(BufferStrategy.MINIMAL.isMoreConservativeThan(BufferStrategy.AGGRESSIVE));
            assertFalse(BufferStrategy.AGGRESSIVE.isMoreConservativeThan(BufferStrategy.MINIMAL));
        }

        @ParameterizedTest
        @EnumSource(BufferStrategy.class)
        @DisplayName("a strategy is never more conservative than itself")
        void strategyIsNotMoreConservativeThanItself(BufferStrategy strategy) {
            assertFalse(strategy.isMoreConservativeThan(strategy));
        }
    }

    @Nested
    @DisplayName("min")
    class MinTests {

        @Test
        @DisplayName("should pick the more conservative strategy")
        void shouldPickMoreConservative() {
            assertEquals(BufferStrategy.CONSERVATIVE,
                    BufferStrategy.min(BufferStrategy.AGGRESSIVE, BufferStrategy.CONSERVATIVE));
            assertEquals(BufferStrategy.MINIMAL,
                    BufferStrategy.min(BufferStrategy.MINIMAL, BufferStrategy.BALANCED));
        }

        @ParameterizedTest
        @EnumSource(BufferStrategy.class)
        @DisplayName("should be idempotent")
        void shouldBeIdempotent(BufferStrategy strategy) {
            assertEquals(strategy, BufferStrategy.min(strategy, strategy));
        }
    }

    @Nested
    @DisplayName("fromRank")
    class FromRankTests {

        @ParameterizedTest
        @EnumSource(BufferStrategy.class)
        @DisplayName("should resolve every rank")
        void shouldResolveEveryRank(BufferStrategy strategy) {
            assertEquals(strategy, BufferStrategy.fromRank(strategy.getRank()));
        }

        @Test
        @DisplayName("should reject unknown rank")
        void shouldRejectUnknownRank() {
            assertThrows(IllegalArgumentException.class, () -> BufferStrategy.fromRank(4));
        }
    }
}
