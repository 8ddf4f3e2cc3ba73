package com.ryuqq.breaker.core.config;

import com.ryuqq.breaker.core.threshold.ThresholdPolicy;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p>이 record는 Circuit Breaker의 동작을 제어하는 설정 스냅샷입니다.
 * 실행 중에는 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: breaker 이름 (기본 "default")</li>
 *   <li>failureThreshold: trip 판정 정책 (기본 ConsecutiveFailures(5))</li>
 *   <li>successThreshold: HALF_OPEN → CLOSED에 필요한 연속 성공 수 (기본 1)</li>
 *   <li>timeout: OPEN 상태 유지 시간 (기본 60초)</li>
 *   <li>rollingWindow: 실패율 집계 윈도우 (기본 10초)</li>
 *   <li>rollingWindowBuckets: 윈도우 bucket 수 (기본 10)</li>
 *   <li>minimumRequestVolume: 실패율 판정에 필요한 윈도우 내 최소 요청 수 (기본 3)</li>
 *   <li>resetTimeout: CLOSED 상태 카운터 초기화 주기 (기본 Duration.ZERO = 비활성)</li>
 *   <li>failurePredicate: 실패 분류 함수 (기본 null = 모든 예외가 실패)</li>
 *   <li>ignoredErrors: 실패로 집계하지 않을 예외 인스턴스 (동일성 비교)</li>
 *   <li>ignoredExceptionTypes: 실패로 집계하지 않을 예외 타입 (하위 타입 포함)</li>
 * </ul>
 *
 * <p><strong>정규화:</strong> 잘못된 값은 거부하지 않고 기본값으로 대체합니다
 * (빈 이름 → "default", 0 이하 successThreshold → 1, null 또는 0 이하 timeout → 60초 등).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BreakerSettings settings = BreakerSettings.defaults()
 *     .withName("payment-api")
 *     .withFailureThreshold(ThresholdPolicy.failureRate(0.5, 10))
 *     .withTimeout(Duration.ofSeconds(30));
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 * @param name breaker 이름
 * @param failureThreshold trip 판정 정책
 * @param successThreshold HALF_OPEN에서 CLOSED로 전이하기 위한 연속 성공 수
 * @param timeout OPEN 상태 유지 시간
 * @param rollingWindow 실패율 집계 윈도우 길이
 * @param rollingWindowBuckets 윈도우 bucket 수
 * @param minimumRequestVolume 실패율 판정에 필요한 최소 요청 수
 * @param resetTimeout CLOSED 상태 카운터 초기화 주기 (ZERO = 비활성)
 * @param failurePredicate 실패 분류 함수 (null 허용)
 * @param ignoredErrors 실패로 집계하지 않을 예외 인스턴스
 * @param ignoredExceptionTypes 실패로 집계하지 않을 예외 타입
 */
public record BreakerSettings(
    String name,
    ThresholdPolicy failureThreshold,
    long successThreshold,
    Duration timeout,
    Duration rollingWindow,
    int rollingWindowBuckets,
    long minimumRequestVolume,
    Duration resetTimeout,
    Predicate<Throwable> failurePredicate,
    List<Throwable> ignoredErrors,
    List<Class<? extends Throwable>> ignoredExceptionTypes
) {

    public static final String DEFAULT_NAME = "default";
    public static final long DEFAULT_CONSECUTIVE_FAILURES = 5;
    public static final long DEFAULT_SUCCESS_THRESHOLD = 1;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_ROLLING_WINDOW = Duration.ofSeconds(10);
    public static final int DEFAULT_ROLLING_WINDOW_BUCKETS = 10;
    public static final long DEFAULT_MINIMUM_REQUEST_VOLUME = 3;

    /**
     * Compact constructor (정규화).
     */
    public BreakerSettings {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (failureThreshold == null) {
            failureThreshold = ThresholdPolicy.consecutiveFailures(DEFAULT_CONSECUTIVE_FAILURES);
        }
        if (successThreshold <= 0) {
            successThreshold = DEFAULT_SUCCESS_THRESHOLD;
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (rollingWindow == null || rollingWindow.isZero() || rollingWindow.isNegative()) {
            rollingWindow = DEFAULT_ROLLING_WINDOW;
        }
        if (rollingWindowBuckets <= 0) {
            rollingWindowBuckets = DEFAULT_ROLLING_WINDOW_BUCKETS;
        }
        if (minimumRequestVolume < 0) {
            minimumRequestVolume = 0;
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            resetTimeout = Duration.ZERO;
        }
        ignoredErrors = ignoredErrors == null ? List.of() : List.copyOf(ignoredErrors);
        ignoredExceptionTypes = ignoredExceptionTypes == null ? List.of() : List.copyOf(ignoredExceptionTypes);
    }

    /**
     * 기본 설정 생성.
     *
     * @return 기본값으로 채워진 설정
     */
    public static BreakerSettings defaults() {
        return new BreakerSettings(
            DEFAULT_NAME,
            ThresholdPolicy.consecutiveFailures(DEFAULT_CONSECUTIVE_FAILURES),
            DEFAULT_SUCCESS_THRESHOLD,
            DEFAULT_TIMEOUT,
            DEFAULT_ROLLING_WINDOW,
            DEFAULT_ROLLING_WINDOW_BUCKETS,
            DEFAULT_MINIMUM_REQUEST_VOLUME,
            Duration.ZERO,
            null,
            List.of(),
            List.of()
        );
    }

    /**
     * CLOSED 상태 카운터 초기화 타이머 사용 여부.
     *
     * @return resetTimeout이 0보다 크면 true
     */
    public boolean isResetTimeoutEnabled() {
        return !resetTimeout.isZero();
    }

    public BreakerSettings withName(String name) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withFailureThreshold(ThresholdPolicy failureThreshold) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withSuccessThreshold(long successThreshold) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withTimeout(Duration timeout) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withRollingWindow(Duration rollingWindow) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withRollingWindowBuckets(int rollingWindowBuckets) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withMinimumRequestVolume(long minimumRequestVolume) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withResetTimeout(Duration resetTimeout) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withFailurePredicate(Predicate<Throwable> failurePredicate) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withIgnoredErrors(List<Throwable> ignoredErrors) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }

    public BreakerSettings withIgnoredExceptionTypes(List<Class<? extends Throwable>> ignoredExceptionTypes) {
        return new BreakerSettings(name, failureThreshold, successThreshold, timeout, rollingWindow,
            rollingWindowBuckets, minimumRequestVolume, resetTimeout, failurePredicate, ignoredErrors,
            ignoredExceptionTypes);
    }
}
