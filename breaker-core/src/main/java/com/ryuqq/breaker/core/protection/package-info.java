/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Circuit Breaker의 확장점을 제공합니다. 불안정한 의존 서비스 호출 시 발생할 수 있는
 * 장애를 격리하고 시스템 안정성을 보장하기 위한 {@link com.ryuqq.breaker.core.protection.CircuitBreaker}
 * 인터페이스와 상태 열거형을 정의합니다.</p>
 *
 * <h2>상태 전이 규칙</h2>
 * <pre>
 * CLOSED    → OPEN       (임계값 정책 trip)
 * OPEN      → HALF_OPEN  (timeout 경과)
 * HALF_OPEN → CLOSED     (successThreshold 연속 성공)
 * HALF_OPEN → OPEN       (실패 1회)
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지에 NoOp (No Operation) 기본 구현을 제공합니다.
 * 모든 요청을 항상 통과시키고 상태를 추적하지 않으므로, 개발/테스트 환경에서
 * 보호 없이 실행할 때 사용합니다.</p>
 *
 * <h2>사용 예시</h2>
 *
 * <h3>개발/테스트 환경 (NoOp 사용)</h3>
 * <pre>{@code
 * CircuitBreaker cb = new NoOpCircuitBreaker("inventory-api");
 * }</pre>
 *
 * <h3>프로덕션 환경 (엔진 사용)</h3>
 * <pre>{@code
 * // breaker-runtime 모듈
 * CircuitBreaker cb = CircuitBreakers.newBreaker(settings);
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 * @see com.ryuqq.breaker.core.protection.CircuitBreaker
 * @see com.ryuqq.breaker.core.protection.CircuitBreakerState
 * @see com.ryuqq.breaker.core.protection.noop
 */
package com.ryuqq.breaker.core.protection;
