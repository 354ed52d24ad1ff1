package fr.lapetina.mcp.client.domain.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryStrategyTest {

    private static final Duration BASE = Duration.ofMillis(100);

    @Nested
    @DisplayName("Base delay formulas")
    class FormulaTests {

        @Test
        @DisplayName("should scale linearly with the retry number")
        void shouldScaleLinearly() {
            assertThat(RetryStrategy.LINEAR.baseDelay(1, BASE)).isEqualTo(Duration.ofMillis(100));
            assertThat(RetryStrategy.LINEAR.baseDelay(2, BASE)).isEqualTo(Duration.ofMillis(200));
            assertThat(RetryStrategy.LINEAR.baseDelay(5, BASE)).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        @DisplayName("should double on each exponential retry")
        void shouldDoubleExponentially() {
            assertThat(RetryStrategy.EXPONENTIAL.baseDelay(1, BASE)).isEqualTo(Duration.ofMillis(100));
            assertThat(RetryStrategy.EXPONENTIAL.baseDelay(2, BASE)).isEqualTo(Duration.ofMillis(200));
            assertThat(RetryStrategy.EXPONENTIAL.baseDelay(3, BASE)).isEqualTo(Duration.ofMillis(400));
            assertThat(RetryStrategy.EXPONENTIAL.baseDelay(6, BASE)).isEqualTo(Duration.ofMillis(3200));
        }

        @Test
        @DisplayName("should follow the Fibonacci sequence starting 1, 1")
        void shouldFollowFibonacci() {
            long[] expected = {1, 1, 2, 3, 5, 8, 13, 21};
            for (int attempt = 1; attempt <= expected.length; attempt++) {
                assertThat(RetryStrategy.FIBONACCI.baseDelay(attempt, BASE))
                        .as("attempt %d", attempt)
                        .isEqualTo(BASE.multipliedBy(expected[attempt - 1]));
            }
        }

        @Test
        @DisplayName("should return zero for NONE")
        void shouldReturnZeroForNone() {
            assertThat(RetryStrategy.NONE.baseDelay(1, BASE)).isZero();
            assertThat(RetryStrategy.NONE.baseDelay(10, BASE)).isZero();
            assertThat(RetryStrategy.NONE.allowsRetries()).isFalse();
        }

        @Test
        @DisplayName("should saturate instead of overflowing")
        void shouldSaturateOnOverflow() {
            Duration huge = RetryStrategy.EXPONENTIAL.baseDelay(200, Duration.ofSeconds(1));

            assertThat(huge).isEqualTo(Duration.ofMillis(Long.MAX_VALUE));
            assertThat(RetryStrategy.FIBONACCI.baseDelay(500, BASE)).isEqualTo(Duration.ofMillis(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("should reject retry numbers below 1")
        void shouldRejectAttemptZero() {
            assertThatThrownBy(() -> RetryStrategy.LINEAR.baseDelay(0, BASE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should parse names case-insensitively")
    void shouldParseNames() {
        assertThat(RetryStrategy.fromName("exponential")).isEqualTo(RetryStrategy.EXPONENTIAL);
        assertThat(RetryStrategy.fromName(" Fibonacci ")).isEqualTo(RetryStrategy.FIBONACCI);
        assertThatThrownBy(() -> RetryStrategy.fromName("random"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
