package com.ryuqq.breaker.core.threshold;

import java.time.Duration;

/**
 * 연속 실패 횟수 기준 정책.
 *
 * <p>연속 실패 횟수가 threshold 이상이면 trip합니다.
 * 성공 수, 전체 요청 수, 윈도우 길이는 사용하지 않습니다.</p>
 *
 * @param threshold 연속 실패 임계값 (0 이상)
 * @author Breaker Team
 * @since 1.0.0
 */
public record ConsecutiveFailuresThreshold(long threshold) implements ThresholdPolicy {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException threshold가 음수인 경우
     */
    public ConsecutiveFailuresThreshold {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold cannot be negative (current: " + threshold + ")");
        }
    }

    @Override
    public boolean shouldTrip(long failures, long successes, long total, Duration window) {
        return failures >= threshold;
    }

    @Override
    public boolean usesRollingWindow() {
        return false;
    }

    @Override
    public String name() {
        return "ConsecutiveFailures";
    }
}
