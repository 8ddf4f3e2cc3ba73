package com.ryuqq.breaker.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerErrorsTest {

    @Test
    void 직접_거부_예외는_true() {
        assertThat(CircuitBreakerErrors.isCircuitOpen(new CircuitOpenException("api"))).isTrue();
    }

    @Test
    void 감싸진_거부_예외도_true() {
        Throwable wrapped = new ExecutionException(new IllegalStateException(new CircuitOpenException("api")));

        assertThat(CircuitBreakerErrors.isCircuitOpen(wrapped)).isTrue();
    }

    @Test
    void CircuitBreakerException_안의_거부_예외도_인식한다() {
        Throwable wrapped = new CircuitBreakerException("api", new CircuitOpenException("api"));

        assertThat(CircuitBreakerErrors.isCircuitOpen(wrapped)).isTrue();
    }

    @Test
    void 다른_예외와_null은_false() {
        assertThat(CircuitBreakerErrors.isCircuitOpen(new IOException("down"))).isFalse();
        assertThat(CircuitBreakerErrors.isCircuitOpen(null)).isFalse();
    }

    @Test
    void 순환_cause_체인에서도_종료한다() {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second", first);
        first.initCause(second);

        assertThat(CircuitBreakerErrors.isCircuitOpen(first)).isFalse();
    }

    @Test
    void 거부_예외_메시지와_이름() {
        CircuitOpenException e = new CircuitOpenException("payment-api");

        assertThat(e.getBreakerName()).isEqualTo("payment-api");
        assertThat(e.getMessage()).isEqualTo("circuit breaker 'payment-api' is open");
        assertThat(e.getStackTrace()).isEmpty();
    }

    @Test
    void CircuitBreakerException은_원인을_보존한다() {
        IOException cause = new IOException("down");

        CircuitBreakerException e = new CircuitBreakerException("api", cause);

        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.getMessage()).contains("api").contains("down");
    }
}
