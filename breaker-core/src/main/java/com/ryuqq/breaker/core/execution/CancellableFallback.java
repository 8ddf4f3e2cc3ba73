package com.ryuqq.breaker.core.execution;

/**
 * 취소 신호를 전달받는 fallback.
 *
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellableFallback<T> {

    /**
     * 대체 결과 생성.
     *
     * @param signal 호출자의 취소 신호
     * @param cause 기본 호출이 던진 예외
     * @return 대체 결과
     * @throws Exception fallback 자체의 실패
     */
    T recover(CancellationSignal signal, Exception cause) throws Exception;
}
