package com.ryuqq.breaker.core.protection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CircuitBreakerState 전이 규칙 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("CircuitBreakerState 테스트")
class CircuitBreakerStateTest {

    @ParameterizedTest(name = "{0} -> {1} = {2}")
    @CsvSource({
        "CLOSED, CLOSED, false",
        "CLOSED, OPEN, true",
        "CLOSED, HALF_OPEN, false",
        "OPEN, CLOSED, false",
        "OPEN, OPEN, false",
        "OPEN, HALF_OPEN, true",
        "HALF_OPEN, CLOSED, true",
        "HALF_OPEN, OPEN, true",
        "HALF_OPEN, HALF_OPEN, false"
    })
    void canTransitionTo_허용된_전이만_true(CircuitBreakerState from, CircuitBreakerState to, boolean expected) {
        assertThat(from.canTransitionTo(to)).isEqualTo(expected);
    }

    @Test
    void canTransitionTo_null은_false() {
        assertThat(CircuitBreakerState.HALF_OPEN.canTransitionTo(null)).isFalse();
    }

    @Test
    void permitsCalls_OPEN만_false() {
        assertThat(CircuitBreakerState.CLOSED.permitsCalls()).isTrue();
        assertThat(CircuitBreakerState.HALF_OPEN.permitsCalls()).isTrue();
        assertThat(CircuitBreakerState.OPEN.permitsCalls()).isFalse();
    }
}
