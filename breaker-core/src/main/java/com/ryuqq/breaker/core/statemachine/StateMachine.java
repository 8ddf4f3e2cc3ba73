package com.ryuqq.breaker.core.statemachine;

import com.ryuqq.breaker.core.protection.CircuitBreakerState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit Breaker 상태 머신.
 *
 * <p>현재 상태와 마지막 상태 변경 시각을 보유하고, 상태 전이를 적용한 뒤
 * 등록된 {@link TransitionHook}을 동기적으로 호출합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>초기 상태는 CLOSED</li>
 *   <li>같은 상태로의 전이는 no-op (시각 갱신 없음, Hook 호출 없음)</li>
 *   <li>전이 적용과 Hook 호출은 단일 lock으로 직렬화</li>
 * </ul>
 *
 * <p>전이 합법성은 검증하지 않습니다. 합법적인 전이만 요청하는 것은 호출자(엔진)의 책임이며,
 * 규칙은 {@link CircuitBreakerState#canTransitionTo(CircuitBreakerState)}에 정의되어 있습니다.</p>
 *
 * <p>상태 조회는 lock 없이 가능합니다 (volatile 필드).</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class StateMachine {

    private final ReentrantLock transitionLock = new ReentrantLock();
    private final Clock clock;
    private final TransitionHook hook;

    private volatile CircuitBreakerState state;
    private volatile Instant lastStateChange;

    /**
     * 생성자 (시스템 시계, Hook 없음).
     */
    public StateMachine() {
        this(Clock.systemUTC(), TransitionHook.none());
    }

    /**
     * 생성자.
     *
     * @param clock 시각 기준
     * @param hook 상태 전이 Hook
     * @throws IllegalArgumentException clock 또는 hook이 null인 경우
     */
    public StateMachine(Clock clock, TransitionHook hook) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        this.clock = clock;
        this.hook = hook;
        this.state = CircuitBreakerState.CLOSED;
        this.lastStateChange = clock.instant();
    }

    /**
     * 현재 상태 조회.
     *
     * @return 현재 상태
     */
    public CircuitBreakerState getState() {
        return state;
    }

    /**
     * 마지막 상태 변경 시각 조회.
     *
     * @return 마지막 상태 변경 시각 (초기값: 생성 시각)
     */
    public Instant getLastStateChange() {
        return lastStateChange;
    }

    /**
     * 현재 상태에 머문 시간.
     *
     * @return now - lastStateChange
     */
    public Duration getTimeInState() {
        return Duration.between(lastStateChange, clock.instant());
    }

    /**
     * 대상 상태로 전이.
     *
     * <p>현재 상태와 같으면 아무 것도 하지 않습니다.
     * 다르면 상태와 시각을 갱신하고, 반환 전에 Hook을 호출합니다.</p>
     *
     * @param target 전이할 상태
     * @return 실제로 전이가 적용된 경우 true
     * @throws IllegalArgumentException target이 null인 경우
     */
    public boolean transitionTo(CircuitBreakerState target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        transitionLock.lock();
        try {
            return apply(target);
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * 현재 상태가 expected인 경우에만 전이.
     *
     * <p>타이머와 동시 호출이 같은 전이를 중복 적용하지 않도록 사용합니다.</p>
     *
     * @param expected 기대하는 현재 상태
     * @param target 전이할 상태
     * @return 실제로 전이가 적용된 경우 true
     * @throws IllegalArgumentException expected 또는 target이 null인 경우
     */
    public boolean compareAndTransition(CircuitBreakerState expected, CircuitBreakerState target) {
        if (expected == null || target == null) {
            throw new IllegalArgumentException(
                "States cannot be null (expected: " + expected + ", target: " + target + ")"
            );
        }
        transitionLock.lock();
        try {
            if (state != expected) {
                return false;
            }
            return apply(target);
        } finally {
            transitionLock.unlock();
        }
    }

    public boolean isClosed() {
        return state == CircuitBreakerState.CLOSED;
    }

    public boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }

    public boolean isHalfOpen() {
        return state == CircuitBreakerState.HALF_OPEN;
    }

    // transitionLock 보유 상태에서만 호출
    private boolean apply(CircuitBreakerState target) {
        CircuitBreakerState previous = state;
        if (previous == target) {
            return false;
        }
        state = target;
        lastStateChange = clock.instant();
        hook.onTransition(previous, target);
        return true;
    }
}
