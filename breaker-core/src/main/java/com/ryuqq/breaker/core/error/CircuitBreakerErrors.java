package com.ryuqq.breaker.core.error;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Circuit Breaker 예외 판별 유틸리티.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerErrors {

    // Utility class - prevent instantiation
    private CircuitBreakerErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외가 "circuit open" 거부인지 확인.
     *
     * <p>예외 자신 또는 cause chain 어딘가에 {@link CircuitOpenException}이 있으면 true입니다.
     * {@link CircuitBreakerException}으로 감싸진 경우도 포함합니다.</p>
     *
     * @param throwable 검사할 예외 (null 허용)
     * @return circuit open 거부이면 true
     */
    public static boolean isCircuitOpen(Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof CircuitOpenException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
