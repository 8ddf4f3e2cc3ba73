package com.ryuqq.breaker.core.execution;

/**
 * 기본 호출 실패(거부 포함) 시 대체 결과를 생성하는 함수.
 *
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Fallback<T> {

    /**
     * 대체 결과 생성.
     *
     * @param cause 기본 호출이 던진 예외 ({@link com.ryuqq.breaker.core.error.CircuitOpenException} 포함)
     * @return 대체 결과
     * @throws Exception fallback 자체의 실패
     */
    T recover(Exception cause) throws Exception;
}
