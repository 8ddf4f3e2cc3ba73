package com.ryuqq.breaker.runtime;

import com.ryuqq.breaker.core.config.BreakerSettings;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;
import com.ryuqq.breaker.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.breaker.core.threshold.ThresholdPolicy;
import com.ryuqq.breaker.testkit.RecordingBreakerEventListener;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakersTest {

    @Test
    void ofDefaults는_default_이름의_CLOSED_breaker() {
        CircuitBreaker cb = CircuitBreakers.ofDefaults();
        try {
            assertThat(cb).isInstanceOf(DefaultCircuitBreaker.class);
            assertThat(cb.getName()).isEqualTo("default");
            assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        } finally {
            cb.shutdown();
        }
    }

    @Test
    void newBreaker는_listener를_등록한다() {
        // given
        RecordingBreakerEventListener first = new RecordingBreakerEventListener();
        RecordingBreakerEventListener second = new RecordingBreakerEventListener();
        BreakerSettings settings = BreakerSettings.defaults()
            .withName("orders-api")
            .withFailureThreshold(ThresholdPolicy.consecutiveFailures(1));

        CircuitBreaker cb = CircuitBreakers.newBreaker(settings, first, second);
        try {
            // when
            assertThatThrownBy(() -> cb.execute(() -> {
                throw new IllegalStateException("down");
            })).isInstanceOf(IllegalStateException.class);

            // then
            assertThat(first.stateChanges()).hasSize(1);
            assertThat(second.stateChanges()).isEqualTo(first.stateChanges());
        } finally {
            cb.shutdown();
        }
    }

    @Test
    void null_settings는_거부() {
        assertThatThrownBy(() -> CircuitBreakers.newBreaker((BreakerSettings) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void noop은_NoOpCircuitBreaker() {
        CircuitBreaker cb = CircuitBreakers.noop("legacy-api");

        assertThat(cb).isInstanceOf(NoOpCircuitBreaker.class);
        assertThat(cb.getName()).isEqualTo("legacy-api");
    }
}
