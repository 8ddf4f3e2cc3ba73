/**
 * SLF4J Adapter - Circuit Breaker 이벤트 로깅 Sink.
 *
 * <p>{@link com.ryuqq.breaker.core.event.BreakerEventListener}를 구현하여
 * 이벤트와 지표를 SLF4J로 기록합니다. 바인딩(Logback 등)은 애플리케이션이 선택합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.adapter.slf4j;
