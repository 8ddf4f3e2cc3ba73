package com.ryuqq.breaker.core.protection.noop;

import com.ryuqq.breaker.core.config.BreakerSettings;
import com.ryuqq.breaker.core.event.BreakerEventPublisher;
import com.ryuqq.breaker.core.execution.CancellableOperation;
import com.ryuqq.breaker.core.execution.CancellationSignal;
import com.ryuqq.breaker.core.metrics.BreakerMetrics;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 통과시키며, 상태 추적을 하지 않습니다.
 * 개발 및 테스트 환경에서 사용하거나, 보호 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 취소 신호 확인 후 항상 호출 실행</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getMetrics(): 항상 0으로 채워진 지표 반환</li>
 *   <li>reset(), shutdown(): 아무 동작 안 함</li>
 *   <li>이벤트 observer는 등록할 수 있지만 호출되지 않음</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final Instant createdAt = Instant.now();
    private final BreakerEventPublisher eventPublisher = new BreakerEventPublisher();

    public NoOpCircuitBreaker() {
        this(BreakerSettings.DEFAULT_NAME);
    }

    public NoOpCircuitBreaker(String name) {
        this.name = name == null || name.isBlank() ? BreakerSettings.DEFAULT_NAME : name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public <T> T execute(CancellationSignal signal, CancellableOperation<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        CancellationSignal effective = signal == null ? CancellationSignal.none() : signal;
        effective.throwIfCancelled();
        return operation.call(effective);
    }

    @Override
    public BreakerMetrics getMetrics() {
        return new BreakerMetrics(name, CircuitBreakerState.CLOSED, 0, 0, 0, 0,
            createdAt, Duration.between(createdAt, Instant.now()));
    }

    @Override
    public BreakerEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void shutdown() {
        // NoOp
    }
}
