package com.ryuqq.breaker.core.error;

/**
 * Circuit이 OPEN 상태라서 호출이 거부되었음을 나타내는 예외.
 *
 * <p>보호 대상 호출에 도달하지 않고 Circuit Breaker 내부에서 생성됩니다.
 * 거부는 빈번하게 발생할 수 있으므로 stack trace를 기록하지 않습니다.</p>
 *
 * <p>감싸진 경우까지 포함하여 판별하려면
 * {@link CircuitBreakerErrors#isCircuitOpen(Throwable)}을 사용합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName 호출을 거부한 Circuit Breaker 이름
     */
    public CircuitOpenException(String breakerName) {
        super("circuit breaker '" + breakerName + "' is open", null, false, false);
        this.breakerName = breakerName;
    }

    /**
     * 호출을 거부한 Circuit Breaker 이름.
     *
     * @return breaker 이름
     */
    public String getBreakerName() {
        return breakerName;
    }
}
