package com.ivamare.agentqueue.backpressure;

import com.ivamare.agentqueue.model.ThrottleMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BackpressureMonitor")
class BackpressureMonitorTest {

    @Nested
    @DisplayName("decideThrottle")
    class DecideThrottleTests {

        private final BackpressureThresholds thresholds = BackpressureThresholds.defaults();

        @Test
        @DisplayName("should map depth bands to modes")
        void shouldMapDepthBands() {
            assertEquals(ThrottleMode.NONE, BackpressureMonitor.decideThrottle(0, thresholds));
            assertEquals(ThrottleMode.NONE, BackpressureMonitor.decideThrottle(100, thresholds));
            assertEquals(ThrottleMode.SCALE, BackpressureMonitor.decideThrottle(101, thresholds));
            assertEquals(ThrottleMode.LIGHT, BackpressureMonitor.decideThrottle(501, thresholds));
            assertEquals(ThrottleMode.HEAVY, BackpressureMonitor.decideThrottle(1_001, thresholds));
            assertEquals(ThrottleMode.EMERGENCY, BackpressureMonitor.decideThrottle(5_001, thresholds));
        }

        @Test
        @DisplayName("should never get less severe as depth grows")
        void shouldBeMonotonic() {
            List<ThrottleMode> modes = new ArrayList<>();
            for (long depth = 0; depth <= 6_000; depth += 50) {
                modes.add(BackpressureMonitor.decideThrottle(depth, thresholds));
            }

            for (int i = 1; i < modes.size(); i++) {
                assertFalse(modes.get(i - 1).isMoreSevereThan(modes.get(i)));
            }
        }

        @Test
        @DisplayName("should only use the light mark when others are disabled")
        void shouldUseLightOnly() {
            BackpressureThresholds lightOnly = BackpressureThresholds.lightOnly(500);

            assertEquals(ThrottleMode.NONE, BackpressureMonitor.decideThrottle(50, lightOnly));
            assertEquals(ThrottleMode.LIGHT, BackpressureMonitor.decideThrottle(600, lightOnly));
            assertEquals(ThrottleMode.LIGHT, BackpressureMonitor.decideThrottle(1_000_000, lightOnly));
        }
    }

    @Test
    @DisplayName("should reject thresholds that are not strictly increasing")
    void shouldRejectUnorderedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new BackpressureThresholds(100, 100, 1_000, 5_000));
        assertThrows(IllegalArgumentException.class, () -> new BackpressureThresholds(100, 50, 1_000, 5_000));
        assertThrows(IllegalArgumentException.class, () -> new BackpressureThresholds(-1, 50, 1_000, 5_000));
    }

    @Test
    @DisplayName("should read depth of the organization request queue")
    void shouldReadRequestQueueDepth() {
        List<String> inspected = new ArrayList<>();
        BackpressureMonitor monitor = new BackpressureMonitor(queue -> {
            inspected.add(queue);
            return 750L;
        }, BackpressureThresholds.defaults());

        assertEquals(ThrottleMode.LIGHT, monitor.currentMode("acme"));
        assertThat(inspected).containsExactly("org.acme.requests.q");
    }

    @Test
    @DisplayName("should fail open when the broker cannot be read")
    void shouldFailOpen() {
        BackpressureMonitor monitor = new BackpressureMonitor(queue -> {
            throw new IllegalStateException("connection refused");
        }, BackpressureThresholds.defaults());

        assertEquals(0L, monitor.getQueueDepth("acme"));
        assertEquals(ThrottleMode.NONE, monitor.currentMode("acme"));
    }
}
