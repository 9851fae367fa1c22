package com.ivamare.agentqueue.ratelimit;

import io.github.bucket4j.BlockingStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TwoLevelRateLimiter")
class TwoLevelRateLimiterTest {

    private final RecordingStrategy parking = new RecordingStrategy();

    @Test
    @DisplayName("should admit a burst without waiting")
    void shouldAdmitBurstWithoutWaiting() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(new TokenBucketSpec(1, 3), null, parking);

        for (int i = 0; i < 3; i++) {
            assertEquals(Duration.ZERO, limiter.acquire("acme", "u-1"));
        }
        assertThat(parking.parked).isEmpty();
    }

    @Test
    @DisplayName("should park for the time until the next token once the burst is spent")
    void shouldParkWhenBurstSpent() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(new TokenBucketSpec(1, 2), null, parking);
        limiter.acquire("acme", null);
        limiter.acquire("acme", null);

        Duration waited = limiter.acquire("acme", null);

        assertThat(waited).isGreaterThan(Duration.ofMillis(500));
        assertThat(waited).isLessThanOrEqualTo(Duration.ofSeconds(1));
        assertThat(parking.parked).hasSize(1);
    }

    @Test
    @DisplayName("should keep organizations independent")
    void shouldKeepOrganizationsIndependent() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(new TokenBucketSpec(1, 1), null, parking);
        limiter.acquire("acme", null);

        assertEquals(Duration.ZERO, limiter.acquire("globex", null));
        assertEquals(0L, limiter.availableOrgTokens("acme"));
        assertEquals(0L, limiter.availableOrgTokens("globex"));
    }

    @Test
    @DisplayName("should limit each user within an organization separately")
    void shouldLimitUsersSeparately() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(null, new TokenBucketSpec(1, 1), parking);
        limiter.acquire("acme", "alice");

        assertEquals(Duration.ZERO, limiter.acquire("acme", "bob"));
        assertEquals(Duration.ZERO, limiter.acquire("globex", "alice"));
        assertThat(limiter.acquire("acme", "alice")).isPositive();
    }

    @Test
    @DisplayName("should skip levels with a non-positive rate")
    void shouldSkipDisabledLevels() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(TokenBucketSpec.disabled(),
            new TokenBucketSpec(0, 10), parking);

        assertFalse(limiter.isEnabled());
        for (int i = 0; i < 50; i++) {
            assertEquals(Duration.ZERO, limiter.acquire("acme", "alice"));
        }
        assertEquals(Long.MAX_VALUE, limiter.availableOrgTokens("acme"));
    }

    @Test
    @DisplayName("should take the organization token before the user token")
    void shouldConsumeBothLevels() throws InterruptedException {
        TwoLevelRateLimiter limiter = new TwoLevelRateLimiter(new TokenBucketSpec(1, 5),
            new TokenBucketSpec(1, 1), parking);
        limiter.acquire("acme", "alice");

        assertEquals(4L, limiter.availableOrgTokens("acme"));
        assertThat(limiter.acquire("acme", "alice")).isPositive();
        assertEquals(3L, limiter.availableOrgTokens("acme"));
    }

    /**
     * Records requested parks without sleeping.
     */
    private static final class RecordingStrategy implements BlockingStrategy {

        private final List<Long> parked = new ArrayList<>();

        @Override
        public void park(long nanosToPark) {
            parked.add(nanosToPark);
        }
    }
}
