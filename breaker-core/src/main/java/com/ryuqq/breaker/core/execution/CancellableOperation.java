package com.ryuqq.breaker.core.execution;

/**
 * 취소 신호를 전달받는 보호 대상 호출.
 *
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellableOperation<T> {

    /**
     * 호출 실행.
     *
     * @param signal 호출자의 취소 신호 (호출 구현이 확인해야 함)
     * @return 결과
     * @throws Exception 호출 실패
     */
    T call(CancellationSignal signal) throws Exception;
}
