/**
 * 결과 집계 카운터.
 *
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.counter.ConsecutiveCounter} - 연속 성공/실패와 누적 합계</li>
 *   <li>{@link com.ryuqq.breaker.core.counter.RollingWindowCounter} - bucket 기반 시간 윈도우 합계</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.counter;
