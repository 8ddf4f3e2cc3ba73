/**
 * Runtime Layer - Circuit Breaker 엔진 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.breaker.core.protection.CircuitBreaker} SPI의 구체적인 구현을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.runtime.DefaultCircuitBreaker} - 상태 머신, 카운터, 타이머를 조합한 엔진</li>
 *   <li>{@link com.ryuqq.breaker.runtime.CircuitBreakers} - 생성 진입점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * breaker-runtime (DefaultCircuitBreaker)
 *   ↓ implements
 * core/protection (CircuitBreaker SPI)
 *   ↓ depends on
 * core (StateMachine, ConsecutiveCounter, RollingWindowCounter, ThresholdPolicy)
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.runtime;
