package com.ryuqq.breaker.core.event;

import com.ryuqq.breaker.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 이벤트 Sink.
 *
 * <p>로깅, 텔레메트리 등 외부 수집기가 구현합니다. 모든 메서드는 기본 구현이 비어 있으므로
 * 필요한 이벤트만 재정의하면 됩니다. 이벤트는 발생한 스레드에서 동기적으로 전달되며,
 * Sink는 Circuit Breaker의 판단에 영향을 주지 않습니다.</p>
 *
 * <p>Sink가 던진 예외는 격리되지 않고 이벤트를 발생시킨 호출자에게 전파됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface BreakerEventListener {

    /**
     * 상태 전이.
     *
     * @param name breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    default void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        // NoOp
    }

    /**
     * CLOSED → OPEN trip.
     *
     * @param name breaker 이름
     * @param cause trip을 유발한 예외 (상태 전이 Hook에서 발생한 통지는 null)
     */
    default void onTrip(String name, Throwable cause) {
        // NoOp
    }

    /**
     * OPEN/HALF_OPEN → CLOSED 복구.
     *
     * @param name breaker 이름
     */
    default void onReset(String name) {
        // NoOp
    }

    /**
     * 보호 대상 호출 성공.
     *
     * @param name breaker 이름
     */
    default void onSuccess(String name) {
        // NoOp
    }

    /**
     * 실패로 분류된 보호 대상 호출.
     *
     * @param name breaker 이름
     * @param cause 실패 예외
     */
    default void onFailure(String name, Throwable cause) {
        // NoOp
    }

    /**
     * OPEN 상태로 인한 호출 거부.
     *
     * @param name breaker 이름
     */
    default void onRejection(String name) {
        // NoOp
    }
}
