package com.ryuqq.breaker.runtime;

import com.ryuqq.breaker.core.config.BreakerSettings;
import com.ryuqq.breaker.core.event.BreakerEventListener;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.noop.NoOpCircuitBreaker;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Circuit Breaker 생성 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreakers.newBreaker(
 *     BreakerSettings.defaults()
 *         .withName("inventory-api")
 *         .withFailureThreshold(ThresholdPolicy.consecutiveFailures(3))
 *         .withTimeout(Duration.ofSeconds(5)),
 *     new Slf4jBreakerEventListener()
 * );
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitBreakers {

    // Utility class - prevent instantiation
    private CircuitBreakers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 설정의 Circuit Breaker 생성.
     *
     * @return Circuit Breaker
     */
    public static CircuitBreaker ofDefaults() {
        return newBreaker(BreakerSettings.defaults());
    }

    /**
     * Circuit Breaker 생성.
     *
     * @param settings 설정
     * @return Circuit Breaker
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public static CircuitBreaker newBreaker(BreakerSettings settings) {
        return new DefaultCircuitBreaker(settings);
    }

    /**
     * Circuit Breaker 생성 후 이벤트 Sink 등록.
     *
     * @param settings 설정
     * @param listeners 등록할 이벤트 Sink (등록 순서대로 호출됨)
     * @return Circuit Breaker
     * @throws IllegalArgumentException settings 또는 listener가 null인 경우
     */
    public static CircuitBreaker newBreaker(BreakerSettings settings, BreakerEventListener... listeners) {
        CircuitBreaker breaker = newBreaker(settings);
        for (BreakerEventListener listener : listeners) {
            breaker.getEventPublisher().addListener(listener);
        }
        return breaker;
    }

    /**
     * 시계와 scheduler를 지정하여 Circuit Breaker 생성.
     *
     * @param settings 설정
     * @param clock 시각 기준
     * @param scheduler 타이머 scheduler (null이면 전용 scheduler 생성)
     * @return Circuit Breaker
     * @throws IllegalArgumentException settings 또는 clock이 null인 경우
     */
    public static CircuitBreaker newBreaker(BreakerSettings settings, Clock clock, ScheduledExecutorService scheduler) {
        return new DefaultCircuitBreaker(settings, clock, scheduler);
    }

    /**
     * 보호를 적용하지 않는 Circuit Breaker 생성.
     *
     * @param name breaker 이름
     * @return NoOp Circuit Breaker
     */
    public static CircuitBreaker noop(String name) {
        return new NoOpCircuitBreaker(name);
    }
}
