package com.ryuqq.breaker.core.protection.noop;

import com.ryuqq.breaker.core.execution.CancellationSource;
import com.ryuqq.breaker.core.metrics.BreakerMetrics;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpCircuitBreaker 유닛 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("NoOpCircuitBreaker 테스트")
class NoOpCircuitBreakerTest {

    @Test
    @DisplayName("execute() 는 항상 호출을 실행하고 결과를 반환한다")
    void execute_항상_호출_실행() throws Exception {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when
        String result = cb.execute(() -> "ok");

        // then
        assertEquals("ok", result);
    }

    @Test
    @DisplayName("execute() 는 실패가 반복되어도 거부하지 않는다")
    void execute_실패가_반복되어도_거부하지_않음() throws Exception {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker("noop-api");
        for (int i = 0; i < 20; i++) {
            assertThrows(IOException.class, () -> cb.execute(() -> {
                throw new IOException("down");
            }));
        }

        // when
        String result = cb.execute(() -> "still called");

        // then
        assertEquals("still called", result);
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
    }

    @Test
    @DisplayName("취소된 신호는 호출 전에 사유를 던진다")
    void execute_취소된_신호는_호출하지_않음() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();
        CancellationSource source = new CancellationSource();
        source.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThrows(CancellationException.class, () -> cb.execute(source, signal -> calls.incrementAndGet()));
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("getState() 는 항상 CLOSED를 반환한다")
    void getState_항상_CLOSED_반환() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when
        CircuitBreakerState state = cb.getState();

        // then
        assertEquals(CircuitBreakerState.CLOSED, state);
    }

    @Test
    @DisplayName("getMetrics() 는 0으로 채워진 지표를 반환한다")
    void getMetrics_0_지표_반환() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker("noop-api");

        // when
        BreakerMetrics metrics = cb.getMetrics();

        // then
        assertEquals("noop-api", metrics.name());
        assertEquals(0, metrics.totalRequests());
        assertEquals(0, metrics.totalFailures());
        assertEquals(0.0, metrics.failureRate());
    }

    @Test
    @DisplayName("빈 이름은 default로 대체된다")
    void 빈_이름은_default() {
        assertEquals("default", new NoOpCircuitBreaker("  ").getName());
        assertEquals("default", new NoOpCircuitBreaker(null).getName());
    }

    @Test
    @DisplayName("observer 는 호출되지 않는다")
    void observer_호출되지_않음() throws Exception {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();
        AtomicInteger notified = new AtomicInteger();
        cb.getEventPublisher().onSuccess(name -> notified.incrementAndGet());

        // when
        cb.execute(() -> "ok");

        // then
        assertEquals(0, notified.get());
    }

    @Test
    @DisplayName("reset(), shutdown() 은 예외 없이 실행된다")
    void reset_shutdown_예외_없이_실행() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when & then
        assertDoesNotThrow(() -> {
            cb.reset();
            cb.shutdown();
        });
    }
}
