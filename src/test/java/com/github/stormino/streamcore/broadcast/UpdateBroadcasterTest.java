package com.github.stormino.streamcore.broadcast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UpdateBroadcaster")
class UpdateBroadcasterTest {

    private UpdateBroadcaster<String> broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new UpdateBroadcaster<>("test");
    }

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("should deliver every value to every listener")
        void shouldFanOut() {
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();
            broadcaster.subscribe(first::add);
            broadcaster.subscribe(second::add);

            broadcaster.broadcast("a");
            broadcaster.broadcast("b");

            assertEquals(List.of("a", "b"), first);
            assertEquals(List.of("a", "b"), second);
        }

        @Test
        @DisplayName("late listeners should only receive future values")
        void lateListenersReceiveOnlyFutureValues() {
            broadcaster.broadcast("before");
            List<String> received = new ArrayList<>();
            broadcaster.subscribe(received::add);

            broadcaster.broadcast("after");

            assertEquals(List.of("after"), received);
        }

        @Test
        @DisplayName("a throwing listener should not block the others")
        void throwingListenerShouldNotBlockOthers() {
            List<String> received = new ArrayList<>();
            broadcaster.subscribe(value -> {
                throw new IllegalStateException("boom");
            });
            broadcaster.subscribe(received::add);

            assertDoesNotThrow(() -> broadcaster.broadcast("value"));
            assertEquals(List.of("value"), received);
        }
    }

    @Nested
    @DisplayName("Subscription")
    class SubscriptionTests {

        @Test
        @DisplayName("cancel should stop delivery")
        void cancelShouldStopDelivery() {
            List<String> received = new ArrayList<>();
            Subscription subscription = broadcaster.subscribe(received::add);

            broadcaster.broadcast("a");
            subscription.cancel();
            broadcaster.broadcast("b");

            assertEquals(List.of("a"), received);
            assertFalse(subscription.isActive());
            assertEquals(0, broadcaster.getListenerCount());
        }

        @Test
        @DisplayName("cancel should be idempotent")
        void cancelShouldBeIdempotent() {
            Subscription subscription = broadcaster.subscribe(value -> { });

            subscription.cancel();
            assertDoesNotThrow(() -> subscription.cancel());
            assertEquals(0, broadcaster.getListenerCount());
        }

        @Test
        @DisplayName("cancelling one registration should keep an identical listener registered twice")
        void cancelShouldRemoveOnlyOneRegistration() {
            List<String> received = new ArrayList<>();
            java.util.function.Consumer<String> listener = received::add;
            Subscription first = broadcaster.subscribe(listener);
            broadcaster.subscribe(listener);

            first.cancel();
            broadcaster.broadcast("x");

            assertEquals(List.of("x"), received);
        }

        @Test
        @DisplayName("close should cancel")
        void closeShouldCancel() {
            try (Subscription subscription = broadcaster.subscribe(value -> { })) {
                assertTrue(subscription.isActive());
            }
            assertEquals(0, broadcaster.getListenerCount());
        }
    }
}
