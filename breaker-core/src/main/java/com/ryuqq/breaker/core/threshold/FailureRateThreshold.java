package com.ryuqq.breaker.core.threshold;

import java.time.Duration;

/**
 * Rolling window 실패율 기준 정책.
 *
 * <p>전체 요청 수가 minSamples 미만이면 항상 false,
 * 그 외에는 {@code failures / total >= rate}이면 trip합니다.</p>
 *
 * @param rate 실패율 임계값 (0.0 ~ 1.0)
 * @param minSamples 판정에 필요한 최소 요청 수 (0 이상)
 * @author Breaker Team
 * @since 1.0.0
 */
public record FailureRateThreshold(double rate, long minSamples) implements ThresholdPolicy {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException rate가 0.0 ~ 1.0 범위를 벗어나거나 minSamples가 음수인 경우
     */
    public FailureRateThreshold {
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("rate must be between 0.0 and 1.0 (current: " + rate + ")");
        }
        if (minSamples < 0) {
            throw new IllegalArgumentException("minSamples cannot be negative (current: " + minSamples + ")");
        }
    }

    @Override
    public boolean shouldTrip(long failures, long successes, long total, Duration window) {
        if (total < minSamples || total == 0) {
            return false;
        }
        return (double) failures / (double) total >= rate;
    }

    @Override
    public boolean usesRollingWindow() {
        return true;
    }

    @Override
    public String name() {
        return "FailureRate";
    }
}
