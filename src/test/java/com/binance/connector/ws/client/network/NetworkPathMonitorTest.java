package com.binance.connector.ws.client.network;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NetworkPathMonitorTest {

    private ManualNetworkPathSource source;
    private NetworkPathMonitor monitor;
    private final List<NetworkPath> updates = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        source = new ManualNetworkPathSource();
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.close();
        }
    }

    private NetworkPathMonitor start(Duration debounce) {
        monitor = new NetworkPathMonitor(source, debounce);
        monitor.onPathChange(updates::add);
        monitor.fire();
        return monitor;
    }

    @Nested
    @DisplayName("Without debounce")
    class WithoutDebounce {

        @Test
        @DisplayName("Reports the current path on start, flagged as the first update")
        void firstUpdate() {
            start(Duration.ZERO);

            assertThat(monitor.isActive()).isTrue();
            assertThat(updates).hasSize(1);
            assertThat(updates.get(0).isSatisfied()).isTrue();
            assertThat(updates.get(0).isFirstUpdate()).isTrue();
        }

        @Test
        @DisplayName("Later updates are not first updates")
        void laterUpdates() {
            start(Duration.ZERO);

            source.post(NetworkPath.unsatisfied());
            source.post(NetworkPath.satisfied());

            assertThat(updates).hasSize(3);
            assertThat(updates.subList(1, 3)).noneMatch(NetworkPath::isFirstUpdate);
            assertThat(monitor.currentPath().isSatisfied()).isTrue();
        }

        @Test
        @DisplayName("Restarting after invalidate flags the next update as first again")
        void restart() {
            start(Duration.ZERO);
            monitor.invalidate();

            source.post(NetworkPath.unsatisfied());
            assertThat(updates).hasSize(1);
            assertThat(monitor.isActive()).isFalse();

            monitor.fire();

            assertThat(updates).hasSize(2);
            assertThat(updates.get(1).isFirstUpdate()).isTrue();
            assertThat(updates.get(1).isSatisfied()).isFalse();
        }

        @Test
        @DisplayName("Cancelled subscriptions receive nothing")
        void cancelSubscription() {
            start(Duration.ZERO);
            List<NetworkPath> other = new CopyOnWriteArrayList<>();
            NetworkWatcher.Subscription subscription = monitor.onPathChange(other::add);

            subscription.cancel();
            source.post(NetworkPath.unsatisfied());

            assertThat(other).isEmpty();
            assertThat(updates).hasSize(2);
        }

        @Test
        @DisplayName("A failing listener does not stop the others")
        void failingListener() {
            monitor = new NetworkPathMonitor(source);
            monitor.onPathChange(path -> {
                throw new IllegalStateException("boom");
            });
            monitor.onPathChange(updates::add);

            monitor.fire();

            assertThat(updates).hasSize(1);
        }
    }

    @Nested
    @DisplayName("With debounce")
    class WithDebounce {

        @Test
        @DisplayName("Rapid changes collapse into the last settled value")
        void collapsesBursts() {
            start(Duration.ofMillis(100));
            await().atMost(Duration.ofSeconds(2)).until(() -> updates.size() == 1);

            source.post(NetworkPath.unsatisfied());
            source.post(NetworkPath.satisfied());
            source.post(NetworkPath.unsatisfied());

            await().atMost(Duration.ofSeconds(2)).until(() -> updates.size() == 2);
            await().during(Duration.ofMillis(250)).atMost(Duration.ofSeconds(1)).until(() -> updates.size() == 2);
            assertThat(updates.get(1).isSatisfied()).isFalse();
            assertThat(updates.get(1).isFirstUpdate()).isFalse();
        }

        @Test
        @DisplayName("Pending update is dropped on invalidate")
        void invalidateDropsPending() {
            start(Duration.ofMillis(100));
            await().atMost(Duration.ofSeconds(2)).until(() -> updates.size() == 1);

            source.post(NetworkPath.unsatisfied());
            monitor.invalidate();

            await().during(Duration.ofMillis(250)).atMost(Duration.ofSeconds(1)).until(() -> updates.size() == 1);
        }
    }

    @Test
    @DisplayName("Rejects a negative debounce interval")
    void rejectsNegativeDebounce() {
        assertThatThrownBy(() -> new NetworkPathMonitor(source, Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
