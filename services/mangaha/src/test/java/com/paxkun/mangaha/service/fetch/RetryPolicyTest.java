package com.paxkun.mangaha.service.fetch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void defaultsRetryServerErrorsThreeTimes() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.isRetryableStatus(500)).isTrue();
        assertThat(policy.isRetryableStatus(502)).isTrue();
        assertThat(policy.isRetryableStatus(504)).isTrue();
        assertThat(policy.isRetryableStatus(503)).isFalse();
        assertThat(policy.isRetryableStatus(404)).isFalse();
    }

    @Test
    void backoffDoublesAfterEachFailure() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(300));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(600));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(1200));
    }

    @Test
    void canRetryUntilAttemptsAreUsedUp() {
        RetryPolicy policy = new RetryPolicy(2, 0, Set.of(500));

        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isFalse();
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ZERO);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, 0.3, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, -1, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
