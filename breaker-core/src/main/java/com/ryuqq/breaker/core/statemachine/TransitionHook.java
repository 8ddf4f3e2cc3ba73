package com.ryuqq.breaker.core.statemachine;

import com.ryuqq.breaker.core.protection.CircuitBreakerState;

/**
 * 상태 전이 Hook.
 *
 * <p>{@link StateMachine}이 상태를 변경한 직후, 전이 lock을 보유한 상태에서
 * 동기적으로 호출됩니다. 같은 상태로의 전이(no-op)에서는 호출되지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionHook {

    /**
     * 상태 전이 통지.
     *
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onTransition(CircuitBreakerState from, CircuitBreakerState to);

    /**
     * 아무 동작도 하지 않는 Hook.
     *
     * @return no-op Hook
     */
    static TransitionHook none() {
        return (from, to) -> { };
    }
}
