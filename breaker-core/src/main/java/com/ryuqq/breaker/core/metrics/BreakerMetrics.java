package com.ryuqq.breaker.core.metrics;

import com.ryuqq.breaker.core.protection.CircuitBreakerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit Breaker 지표 스냅샷 (읽기 전용).
 *
 * <p>조회 시점에 계산되며 저장되지 않습니다. 실패율 정책을 사용하는 breaker는
 * Rolling window 합계를, 그 외에는 연속 카운터의 누적 합계를 보고합니다.</p>
 *
 * @param name breaker 이름
 * @param state 현재 상태
 * @param totalRequests 전체 요청 수
 * @param totalFailures 전체 실패 수
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param lastStateChange 마지막 상태 변경 시각
 * @param timeInState 현재 상태에 머문 시간
 * @author Breaker Team
 * @since 1.0.0
 */
public record BreakerMetrics(
    String name,
    CircuitBreakerState state,
    long totalRequests,
    long totalFailures,
    long consecutiveFailures,
    long consecutiveSuccesses,
    Instant lastStateChange,
    Duration timeInState
) {

    /**
     * 실패율.
     *
     * @return totalFailures / totalRequests (요청이 없으면 0.0)
     */
    public double failureRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) totalFailures / (double) totalRequests;
    }
}
