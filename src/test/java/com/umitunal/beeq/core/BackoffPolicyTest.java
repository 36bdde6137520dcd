package com.umitunal.beeq.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    @DisplayName("Should double the base delay per attempt")
    void testExponentialGrowth() {
        BackoffPolicy policy = BackoffPolicy.unbounded();

        assertThat(policy.delay(2000, 0)).isEqualTo(2000);
        assertThat(policy.delay(2000, 1)).isEqualTo(4000);
        assertThat(policy.delay(2000, 2)).isEqualTo(8000);
        assertThat(policy.delay(2000, 10)).isEqualTo(2000L * 1024);
    }

    @Test
    @DisplayName("Should grow monotonically")
    void testMonotonic() {
        BackoffPolicy policy = BackoffPolicy.unbounded();
        long previous = 0;

        for (int attempt = 0; attempt < 70; attempt++) {
            long delay = policy.delay(100, attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            previous = delay;
        }
    }

    @Test
    @DisplayName("Should saturate instead of overflowing when unbounded")
    void testSaturation() {
        BackoffPolicy policy = BackoffPolicy.unbounded();

        assertThat(policy.delay(2000, 62)).isEqualTo(Long.MAX_VALUE);
        assertThat(policy.delay(2000, 500)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Should clamp to the configured maximum")
    void testCap() {
        BackoffPolicy policy = BackoffPolicy.capped(Duration.ofMinutes(5));

        assertThat(policy.delay(2000, 3)).isEqualTo(16_000);
        assertThat(policy.delay(2000, 20)).isEqualTo(300_000);
        assertThat(policy.delay(2000, 100)).isEqualTo(300_000);
    }

    @Test
    @DisplayName("Should treat a missing or zero cap as unbounded")
    void testNoCap() {
        assertThat(BackoffPolicy.capped(null).getMaxDelayMillis()).isEqualTo(Long.MAX_VALUE);
        assertThat(BackoffPolicy.capped(Duration.ZERO).getMaxDelayMillis()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Should reject negative input")
    void testNegative() {
        BackoffPolicy policy = BackoffPolicy.unbounded();

        assertThatThrownBy(() -> policy.delay(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.delay(1, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
