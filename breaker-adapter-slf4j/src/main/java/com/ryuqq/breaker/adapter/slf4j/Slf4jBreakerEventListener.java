package com.ryuqq.breaker.adapter.slf4j;

import com.ryuqq.breaker.core.event.BreakerEventListener;
import com.ryuqq.breaker.core.metrics.BreakerMetrics;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 Circuit Breaker 이벤트 Sink.
 *
 * <p>Circuit Breaker 이벤트를 구조화된 key=value 형태의 로그로 기록합니다.
 * breaker 판단에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>상태 전이, reset: INFO</li>
 *   <li>trip: WARN (원인 예외가 있으면 함께 기록)</li>
 *   <li>성공, 실패, 거부, 지표: DEBUG</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Slf4jBreakerEventListener listener = new Slf4jBreakerEventListener();
 * breaker.getEventPublisher().addListener(listener);
 *
 * // 주기적 지표 기록
 * listener.logMetrics(breaker.getMetrics());
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class Slf4jBreakerEventListener implements BreakerEventListener {

    private final Logger log;

    /**
     * 생성자 (기본 logger).
     */
    public Slf4jBreakerEventListener() {
        this(LoggerFactory.getLogger(Slf4jBreakerEventListener.class));
    }

    /**
     * 생성자.
     *
     * @param log 기록할 logger
     * @throws IllegalArgumentException log가 null인 경우
     */
    public Slf4jBreakerEventListener(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        log.info("circuit breaker state changed: circuit={}, from_state={}, to_state={}", name, from, to);
    }

    @Override
    public void onTrip(String name, Throwable cause) {
        if (cause == null) {
            log.warn("circuit breaker tripped: circuit={}", name);
            return;
        }
        log.warn("circuit breaker tripped: circuit={}, error={}", name, cause.toString());
    }

    @Override
    public void onReset(String name) {
        log.info("circuit breaker reset: circuit={}", name);
    }

    @Override
    public void onSuccess(String name) {
        log.debug("circuit breaker request succeeded: circuit={}", name);
    }

    @Override
    public void onFailure(String name, Throwable cause) {
        log.debug("circuit breaker request failed: circuit={}, error={}", name, String.valueOf(cause));
    }

    @Override
    public void onRejection(String name) {
        log.debug("circuit breaker request rejected: circuit={}", name);
    }

    /**
     * 지표 스냅샷 기록 (DEBUG).
     *
     * @param metrics 지표 스냅샷
     * @throws IllegalArgumentException metrics가 null인 경우
     */
    public void logMetrics(BreakerMetrics metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug(
            "circuit breaker metrics: circuit={}, state={}, total_requests={}, total_failures={}, "
                + "consecutive_failures={}, consecutive_successes={}, time_in_state={}",
            metrics.name(),
            metrics.state(),
            metrics.totalRequests(),
            metrics.totalFailures(),
            metrics.consecutiveFailures(),
            metrics.consecutiveSuccesses(),
            metrics.timeInState()
        );
    }
}
