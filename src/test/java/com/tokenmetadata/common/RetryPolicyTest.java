package com.tokenmetadata.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
        assertThat(policy.delayMs(3)).isEqualTo(800L);
    }

    @Test
    void delayMs_neverExceedsMaxDelay() {
        RetryPolicy policy = new RetryPolicy(10_000L, 0.5, 5, 30_000L);
        for (int attempt = 0; attempt < 40; attempt++) {
            assertThat(policy.delayMs(attempt)).isBetween(0L, 30_000L);
        }
        assertThat(new RetryPolicy(10_000L, 0, 5, 30_000L).delayMs(10)).isEqualTo(30_000L);
    }

    @Test
    void delayMs_largeAttemptDoesNotOverflow() {
        RetryPolicy policy = new RetryPolicy(Long.MAX_VALUE / 4, 0, 5);
        assertThat(policy.delayMs(60)).isPositive();
    }

    @Test
    void constructor_rejectsNonPositiveMaxAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(5);
        assertThat(RetryPolicy.defaultPolicy().getMaxDelayMs()).isEqualTo(300_000L);
    }
}
