package com.ryuqq.breaker.core.threshold;

import java.time.Duration;

/**
 * 실패 임계값 정책.
 *
 * <p>현재 집계값을 받아 "지금 circuit을 열어야 하는가"를 판정합니다.
 * 두 가지 구현만 존재하는 닫힌 집합(sealed)입니다.</p>
 *
 * <ul>
 *   <li>{@link ConsecutiveFailuresThreshold}: 연속 실패 횟수 기준</li>
 *   <li>{@link FailureRateThreshold}: Rolling window 내 실패율 기준</li>
 * </ul>
 *
 * <p>모든 구현은 불변 record이며 부수 효과가 없으므로
 * 동기화 없이 여러 스레드에서 호출할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ThresholdPolicy policy = ThresholdPolicy.consecutiveFailures(3);
 * policy.shouldTrip(3, 0, 3, Duration.ZERO); // true
 *
 * ThresholdPolicy rate = ThresholdPolicy.failureRate(0.5, 10);
 * rate.shouldTrip(5, 5, 10, Duration.ofSeconds(10)); // true
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public sealed interface ThresholdPolicy permits ConsecutiveFailuresThreshold, FailureRateThreshold {

    /**
     * trip 여부 판정.
     *
     * @param failures 실패 수 (정책에 따라 연속 실패 또는 윈도우 내 실패)
     * @param successes 성공 수
     * @param total 전체 요청 수
     * @param window 집계 윈도우 길이
     * @return circuit을 열어야 하면 true
     */
    boolean shouldTrip(long failures, long successes, long total, Duration window);

    /**
     * Rolling window 집계가 필요한 정책인지 여부.
     *
     * @return window 기반 정책이면 true
     */
    boolean usesRollingWindow();

    /**
     * 정책 이름 (로깅용).
     *
     * @return 정책 이름
     */
    String name();

    /**
     * 연속 실패 기준 정책 생성.
     *
     * @param threshold 연속 실패 임계값
     * @return ConsecutiveFailuresThreshold
     */
    static ThresholdPolicy consecutiveFailures(long threshold) {
        return new ConsecutiveFailuresThreshold(threshold);
    }

    /**
     * 실패율 기준 정책 생성.
     *
     * @param rate 실패율 임계값 (0.0 ~ 1.0)
     * @param minSamples 판정에 필요한 최소 요청 수
     * @return FailureRateThreshold
     */
    static ThresholdPolicy failureRate(double rate, long minSamples) {
        return new FailureRateThreshold(rate, minSamples);
    }
}
