package com.ryuqq.breaker.core.counter;

/**
 * Rolling window 내 요청/실패 합계.
 *
 * @param totalRequests 윈도우 내 요청 수
 * @param totalFailures 윈도우 내 실패 수
 * @author Breaker Team
 * @since 1.0.0
 */
public record WindowCounts(long totalRequests, long totalFailures) {

    public static final WindowCounts EMPTY = new WindowCounts(0, 0);

    /**
     * 윈도우 내 성공 수.
     *
     * @return totalRequests - totalFailures
     */
    public long totalSuccesses() {
        return totalRequests - totalFailures;
    }
}
