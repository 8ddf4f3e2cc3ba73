package com.ryuqq.breaker.core.error;

/**
 * Circuit Breaker 이름과 원인을 함께 담는 예외.
 *
 * <p>checked 예외를 던질 수 없는 경로(예: {@code Supplier})에서
 * 원인 예외를 breaker 이름과 함께 감싸 전달할 때 사용합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class CircuitBreakerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName Circuit Breaker 이름
     * @param cause 원인 예외
     */
    public CircuitBreakerException(String breakerName, Throwable cause) {
        super(String.format("circuit breaker '%s': %s", breakerName, cause), cause);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
