package com.umitunal.qcast.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("Should double the delay for every retry")
    void testExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(500), false);

        assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Should keep jittered delays within the upper half of the nominal delay")
    void testJitterBounds() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), true);

        for (int i = 0; i < 100; i++) {
            assertThat(policy.backoffFor(2)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(4));
        }
    }

    @Test
    @DisplayName("Should allow exactly maxRetries retries")
    void testBudget() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(1), false);

        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isFalse();
    }
}
