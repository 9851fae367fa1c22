package com.ivamare.agentqueue.policy;

import com.ivamare.agentqueue.model.ErrorKind;
import com.ivamare.agentqueue.model.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.defaultPolicy();

    @Test
    @DisplayName("should create default policy with a doubling ladder")
    void shouldCreateDefaultPolicy() {
        assertEquals(List.of(1_000L, 2_000L, 4_000L, 8_000L), policy.delayLadderMs());
        assertEquals(60_000L, policy.rateLimitedBackoffMs());
    }

    @Test
    @DisplayName("should make the ladder immutable")
    void shouldMakeLadderImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> policy.delayLadderMs().add(16_000L));
    }

    @Test
    @DisplayName("should reject empty or non-positive ladders")
    void shouldRejectInvalidLadders() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(List.of(), 1_000L));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(List.of(1_000L, 0L), 1_000L));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(List.of(1_000L), 0L));
    }

    @Nested
    @DisplayName("nextDelay")
    class NextDelayTests {

        @Test
        @DisplayName("should index the ladder by retry count")
        void shouldIndexLadder() {
            assertEquals(1_000L, RetryPolicy.nextDelay(0, policy.delayLadderMs()));
            assertEquals(4_000L, RetryPolicy.nextDelay(2, policy.delayLadderMs()));
        }

        @Test
        @DisplayName("should clamp to the last step")
        void shouldClampToLastStep() {
            assertEquals(8_000L, RetryPolicy.nextDelay(3, policy.delayLadderMs()));
            assertEquals(8_000L, RetryPolicy.nextDelay(50, policy.delayLadderMs()));
        }

        @Test
        @DisplayName("should treat negative counts as zero")
        void shouldTreatNegativeAsZero() {
            assertEquals(1_000L, RetryPolicy.nextDelay(-3, policy.delayLadderMs()));
        }
    }

    @Nested
    @DisplayName("decide")
    class DecideTests {

        @Test
        @DisplayName("should retry transient failures on the ladder at unchanged priority")
        void shouldRetryTransientFailures() {
            RetryDecision decision = policy.decide(Priority.P1, 1, 3, ErrorKind.TRANSIENT);

            assertTrue(decision.shouldRetry());
            assertEquals(2_000L, decision.delayMs());
            assertEquals(Priority.P1, decision.nextPriority());
            assertEquals(2, decision.nextRetryCount());
            assertFalse(decision.isDemotion(Priority.P1));
        }

        @Test
        @DisplayName("should never retry validation failures")
        void shouldNeverRetryValidationFailures() {
            for (int retryCount = 0; retryCount < 3; retryCount++) {
                RetryDecision decision = policy.decide(Priority.P0, retryCount, 10, ErrorKind.VALIDATION);
                assertFalse(decision.shouldRetry());
                assertEquals(0L, decision.delayMs());
            }
        }

        @Test
        @DisplayName("should demote rate-limited failures and use the fixed backoff")
        void shouldDemoteRateLimitedFailures() {
            RetryDecision decision = policy.decide(Priority.P1, 0, 3, ErrorKind.RATE_LIMITED);

            assertTrue(decision.shouldRetry());
            assertEquals(Priority.P2, decision.nextPriority());
            assertEquals(RetryPolicy.DEFAULT_RATE_LIMITED_BACKOFF_MS, decision.delayMs());
            assertEquals(1, decision.nextRetryCount());
            assertTrue(decision.isDemotion(Priority.P1));
        }

        @Test
        @DisplayName("should keep P3 at P3 when rate limited")
        void shouldSaturateDemotion() {
            RetryDecision decision = policy.decide(Priority.P3, 0, 3, ErrorKind.RATE_LIMITED);

            assertEquals(Priority.P3, decision.nextPriority());
        }

        @Test
        @DisplayName("should stop once the budget is spent")
        void shouldStopWhenBudgetSpent() {
            assertFalse(policy.decide(Priority.P2, 3, 3, ErrorKind.TRANSIENT).shouldRetry());
            assertFalse(policy.decide(Priority.P2, 0, 0, ErrorKind.RATE_LIMITED).shouldRetry());
        }

        @Test
        @DisplayName("should stay within the ladder for any retry count")
        void shouldStayWithinLadder() {
            for (int retryCount = 0; retryCount < 20; retryCount++) {
                RetryDecision decision = policy.decide(Priority.P2, retryCount, 100, ErrorKind.TRANSIENT);
                assertThat(policy.delayLadderMs()).contains(decision.delayMs());
                assertEquals(retryCount + 1, decision.nextRetryCount());
            }
        }
    }

    @Test
    @DisplayName("should list every distinct delay including the rate-limited backoff")
    void shouldListDistinctDelays() {
        RetryPolicy custom = new RetryPolicy(List.of(500L, 500L, 2_000L), 2_000L);

        assertThat(custom.distinctDelays()).containsExactly(500L, 2_000L);
        assertThat(policy.distinctDelays()).containsExactly(1_000L, 2_000L, 4_000L, 8_000L, 60_000L);
    }
}
