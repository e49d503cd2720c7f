package com.example.commitnotifier.service.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    @Nested
    @DisplayName("Backoff Tests")
    class BackoffTests {

        @Test
        @DisplayName("Should double the delay after each failed attempt")
        void shouldDoubleDelay() {
            var policy = new RetryPolicy(5, Duration.ofMillis(1000), Duration.ofMillis(60_000));

            assertThat(policy.delayAfterAttempt(1)).isEqualTo(Duration.ofMillis(1000));
            assertThat(policy.delayAfterAttempt(2)).isEqualTo(Duration.ofMillis(2000));
            assertThat(policy.delayAfterAttempt(3)).isEqualTo(Duration.ofMillis(4000));
        }

        @Test
        @DisplayName("Should cap the delay at the maximum")
        void shouldCapDelay() {
            var policy = new RetryPolicy(6, Duration.ofMillis(1000), Duration.ofMillis(8000));

            assertThat(policy.delayAfterAttempt(4)).isEqualTo(Duration.ofMillis(8000));
            assertThat(policy.delayAfterAttempt(5)).isEqualTo(Duration.ofMillis(8000));
        }

        @Test
        @DisplayName("Should reject a policy without attempts")
        void shouldRejectZeroAttempts() {
            assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("execute Tests")
    class ExecuteTests {

        private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4));

        @Test
        @DisplayName("Should run once when the action succeeds")
        void shouldRunOnceOnSuccess() {
            var calls = new AtomicInteger();

            assertThatNoException().isThrownBy(() -> policy.execute("acme/api", calls::incrementAndGet));
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("Should stop retrying after the first success")
        void shouldStopAfterSuccess() throws Exception {
            // Given
            var calls = new AtomicInteger();

            // When
            policy.execute("acme/api", () -> {
                if (calls.incrementAndGet() < 2) {
                    throw new IllegalStateException("transient");
                }
            });

            // Then
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("Should rethrow the last failure after all attempts")
        void shouldRethrowLastFailure() {
            // Given
            var calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> policy.execute("acme/api", () -> {
                throw new IllegalStateException("failure " + calls.incrementAndGet());
            }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("failure 3");
            assertThat(calls).hasValue(3);
        }

        @Test
        @DisplayName("Should retry checked exceptions too")
        void shouldRetryCheckedExceptions() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> policy.execute("acme/api", () -> {
                calls.incrementAndGet();
                throw new IOException("connection reset");
            })).isInstanceOf(IOException.class);
            assertThat(calls).hasValue(3);
        }
    }
}
