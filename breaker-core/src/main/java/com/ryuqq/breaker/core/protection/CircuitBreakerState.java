package com.ryuqq.breaker.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 보호 대상 호출의 결과를 추적하고,
 * 의존 서비스가 비정상으로 판단되면 호출을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (임계값 정책이 trip 판정)
 * OPEN (차단)
 *   │
 *   ▼ (timeout 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► successThreshold 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며 실패를 집계합니다.
     * 임계값 정책이 trip을 판정하면 OPEN 상태로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>보호 대상 호출을 실행하지 않고 즉시 거부합니다.
     * timeout이 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 요청 통과).
     *
     * <p>시험(probe) 요청을 한 번에 하나씩 통과시켜 복구 여부를 확인합니다.
     * 실패 1회로 OPEN, 연속 성공이 successThreshold에 도달하면 CLOSED로 전이합니다.</p>
     */
    HALF_OPEN;

    /**
     * 대상 상태로의 전이가 허용되는지 확인.
     *
     * <p>허용되는 전이는 CLOSED → OPEN, OPEN → HALF_OPEN,
     * HALF_OPEN → CLOSED, HALF_OPEN → OPEN 네 가지입니다.</p>
     *
     * @param target 전이할 상태
     * @return 허용되는 전이인 경우 true
     */
    public boolean canTransitionTo(CircuitBreakerState target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case CLOSED -> target == OPEN;
            case OPEN -> target == HALF_OPEN;
            case HALF_OPEN -> target == CLOSED || target == OPEN;
        };
    }

    /**
     * 요청이 보호 대상 호출까지 도달할 수 있는 상태인지 확인.
     *
     * @return CLOSED 또는 HALF_OPEN인 경우 true
     */
    public boolean permitsCalls() {
        return this != OPEN;
    }
}
