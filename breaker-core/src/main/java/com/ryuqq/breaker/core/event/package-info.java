/**
 * 이벤트 통지 패키지.
 *
 * <p>상태 전이, trip, reset, 성공, 실패, 거부 이벤트를 observer에게 동기적으로 전달합니다.
 * observer는 breaker 판단에 영향을 주지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.event;
