/**
 * Circuit Breaker 테스트 도구.
 *
 * <p>시간을 직접 제어하는 {@link com.ryuqq.breaker.testkit.MutableClock},
 * 이벤트 기록용 {@link com.ryuqq.breaker.testkit.RecordingBreakerEventListener},
 * 구현체 공통 계약 테스트 {@link com.ryuqq.breaker.testkit.contract.AbstractCircuitBreakerContractTest}를 제공합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.testkit;
