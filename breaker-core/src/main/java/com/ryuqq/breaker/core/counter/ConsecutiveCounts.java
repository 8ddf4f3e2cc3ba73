package com.ryuqq.breaker.core.counter;

/**
 * {@link ConsecutiveCounter}의 특정 시점 스냅샷.
 *
 * @param consecutiveSuccesses 연속 성공 횟수
 * @param consecutiveFailures 연속 실패 횟수
 * @param totalSuccesses 누적 성공 횟수
 * @param totalFailures 누적 실패 횟수
 * @author Breaker Team
 * @since 1.0.0
 */
public record ConsecutiveCounts(
    long consecutiveSuccesses,
    long consecutiveFailures,
    long totalSuccesses,
    long totalFailures
) {

    /**
     * 누적 요청 수 (성공 + 실패).
     *
     * @return totalSuccesses + totalFailures
     */
    public long totalRequests() {
        return totalSuccesses + totalFailures;
    }
}
