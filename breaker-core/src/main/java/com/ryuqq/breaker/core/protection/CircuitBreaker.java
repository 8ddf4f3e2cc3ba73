package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.error.CircuitBreakerException;
import com.ryuqq.breaker.core.event.BreakerEventPublisher;
import com.ryuqq.breaker.core.execution.CancellableFallback;
import com.ryuqq.breaker.core.execution.CancellableOperation;
import com.ryuqq.breaker.core.execution.CancellationSignal;
import com.ryuqq.breaker.core.execution.Fallback;
import com.ryuqq.breaker.core.metrics.BreakerMetrics;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>불안정한 의존 서비스 호출을 감싸 최근 결과를 추적하고, 의존 서비스가 비정상으로
 * 판단되면 호출을 빠르게 실패(Fail-Fast)시켜 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패 집계</li>
 *   <li>OPEN: 요청 차단, {@link com.ryuqq.breaker.core.error.CircuitOpenException}으로 즉시 실패</li>
 *   <li>HALF_OPEN: 시험 요청을 한 번에 하나씩 통과시켜 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = CircuitBreakers.newBreaker(settings);
 *
 * try {
 *     Result result = cb.execute(() -> externalApi.call());
 * } catch (CircuitOpenException e) {
 *     // Circuit Breaker OPEN 상태
 *     return Result.unavailable();
 * }
 * }</pre>
 *
 * <p><strong>예외 전파:</strong> 보호 대상 호출이 던진 예외는 그대로 호출자에게 전파됩니다.
 * 실패 분류는 내부 집계에만 영향을 주며, 재시도는 하지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * breaker 이름 조회.
     *
     * @return breaker 이름
     */
    String getName();

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 보호 대상 호출 실행.
     *
     * @param operation 보호 대상 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws com.ryuqq.breaker.core.error.CircuitOpenException OPEN 상태로 거부된 경우
     * @throws Exception 보호 대상 호출이 던진 예외 (그대로 전파)
     */
    default <T> T execute(Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return execute(CancellationSignal.none(), signal -> operation.call());
    }

    /**
     * 취소 신호와 함께 보호 대상 호출 실행.
     *
     * <p>진입 시 신호가 이미 취소된 경우 호출을 실행하지 않고 취소 사유를 던집니다.
     * 실행 중 취소는 보호 대상 호출이 신호를 확인하는 방식으로만 동작합니다.</p>
     *
     * @param signal 호출자의 취소 신호
     * @param operation 보호 대상 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws com.ryuqq.breaker.core.error.CircuitOpenException OPEN 상태로 거부된 경우
     * @throws Exception 취소 사유 또는 보호 대상 호출이 던진 예외
     */
    <T> T execute(CancellationSignal signal, CancellableOperation<T> operation) throws Exception;

    /**
     * fallback과 함께 실행.
     *
     * <p>기본 호출이 예외를 던지면(거부 포함) 그 예외로 fallback을 호출하고 결과를 반환합니다.</p>
     *
     * @param operation 보호 대상 호출
     * @param fallback 대체 결과 생성 함수
     * @param <T> 결과 타입
     * @return 호출 결과 또는 fallback 결과
     * @throws Exception fallback이 던진 예외
     */
    default <T> T executeWithFallback(Callable<T> operation, Fallback<T> fallback) throws Exception {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        try {
            return execute(operation);
        } catch (Exception e) {
            return fallback.recover(e);
        }
    }

    /**
     * 취소 신호, fallback과 함께 실행.
     *
     * @param signal 호출자의 취소 신호
     * @param operation 보호 대상 호출
     * @param fallback 대체 결과 생성 함수
     * @param <T> 결과 타입
     * @return 호출 결과 또는 fallback 결과
     * @throws Exception fallback이 던진 예외
     */
    default <T> T executeWithFallback(
        CancellationSignal signal,
        CancellableOperation<T> operation,
        CancellableFallback<T> fallback
    ) throws Exception {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        try {
            return execute(signal, operation);
        } catch (Exception e) {
            return fallback.recover(signal, e);
        }
    }

    /**
     * 보호 대상 호출을 {@link Supplier}로 감쌈.
     *
     * <p>RuntimeException은 그대로, checked 예외는 {@link CircuitBreakerException}으로 감싸 던집니다.</p>
     *
     * @param operation 보호 대상 호출
     * @param <T> 결과 타입
     * @return breaker가 적용된 Supplier
     */
    default <T> Supplier<T> decorate(Callable<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return () -> {
            try {
                return execute(operation);
            } catch (RuntimeException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CircuitBreakerException(getName(), e);
            } catch (Exception e) {
                throw new CircuitBreakerException(getName(), e);
            }
        };
    }

    /**
     * 지표 스냅샷 조회.
     *
     * @return 현재 지표
     */
    BreakerMetrics getMetrics();

    /**
     * 이벤트 발행기 조회 (observer 등록용).
     *
     * @return 이벤트 발행기
     */
    BreakerEventPublisher getEventPublisher();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다. 카운터도 초기화됩니다.
     * 프로덕션 환경에서는 신중하게 사용해야 합니다.</p>
     */
    void reset();

    /**
     * 타이머 리소스 해제.
     *
     * <p>멱등이며 어느 상태에서든 호출할 수 있습니다. 이후에도 {@code execute}는 현재 상태에 따라
     * 동작하지만, 타이머에 의한 자동 전이는 더 이상 발생하지 않습니다.</p>
     */
    void shutdown();
}
