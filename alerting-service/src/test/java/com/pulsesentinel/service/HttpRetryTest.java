package com.pulsesentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HttpRetry}.
 */
class HttpRetryTest {

    @Test
    @DisplayName("Should fit every attempt and the backoff inside the dispatch timeout")
    void shouldFitAttemptsInsideDispatchTimeout() {
        Duration dispatch = Duration.ofSeconds(10);

        Duration perRequest = HttpRetry.requestTimeout(dispatch);

        // 3 attempts with 500 ms and 1000 ms waits between them
        assertThat(perRequest).isEqualTo(Duration.ofMillis(2833));
        assertThat(perRequest.multipliedBy(3).plusMillis(1500)).isLessThanOrEqualTo(dispatch);
    }

    @Test
    @DisplayName("Should split the dispatch timeout evenly when the backoff alone exceeds it")
    void shouldSplitEvenlyWhenBackoffExceedsBudget() {
        Duration perRequest = HttpRetry.requestTimeout(Duration.ofMillis(1000), 3, Duration.ofMillis(500));

        assertThat(perRequest).isEqualTo(Duration.ofMillis(333));
    }

    @Test
    @DisplayName("Should give a single attempt the whole dispatch timeout")
    void shouldUseWholeTimeoutForSingleAttempt() {
        assertThat(HttpRetry.requestTimeout(Duration.ofMillis(750), 1, Duration.ofMillis(500)))
                .isEqualTo(Duration.ofMillis(750));
    }

    @Test
    @DisplayName("Should reject a non-positive attempt count")
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> HttpRetry.requestTimeout(Duration.ofSeconds(1), 0, Duration.ofMillis(500)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should retry only I/O failures and retryable statuses")
    void shouldClassifyRetryableFailures() {
        assertThat(HttpRetry.isRetryable(new IOException("reset"))).isTrue();
        assertThat(HttpRetry.isRetryable(new HttpRetry.RetryableStatusException("HTTP 503"))).isTrue();
        assertThat(HttpRetry.isRetryable(new IllegalStateException("HTTP 404"))).isFalse();
    }
}
