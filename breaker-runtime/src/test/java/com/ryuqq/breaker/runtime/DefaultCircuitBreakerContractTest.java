package com.ryuqq.breaker.runtime;

import com.ryuqq.breaker.core.config.BreakerSettings;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.testkit.contract.AbstractCircuitBreakerContractTest;

/**
 * DefaultCircuitBreaker 계약 테스트.
 */
class DefaultCircuitBreakerContractTest extends AbstractCircuitBreakerContractTest {

    @Override
    protected CircuitBreaker createBreaker(BreakerSettings settings) {
        return new DefaultCircuitBreaker(settings);
    }
}
