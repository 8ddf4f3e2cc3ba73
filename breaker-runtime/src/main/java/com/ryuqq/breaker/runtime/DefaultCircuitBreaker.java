package com.ryuqq.breaker.runtime;

import com.ryuqq.breaker.core.config.BreakerSettings;
import com.ryuqq.breaker.core.counter.ConsecutiveCounter;
import com.ryuqq.breaker.core.counter.ConsecutiveCounts;
import com.ryuqq.breaker.core.counter.RollingWindowCounter;
import com.ryuqq.breaker.core.counter.WindowCounts;
import com.ryuqq.breaker.core.error.CircuitOpenException;
import com.ryuqq.breaker.core.event.BreakerEventPublisher;
import com.ryuqq.breaker.core.execution.CancellableOperation;
import com.ryuqq.breaker.core.execution.CancellationSignal;
import com.ryuqq.breaker.core.metrics.BreakerMetrics;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;
import com.ryuqq.breaker.core.statemachine.StateMachine;
import com.ryuqq.breaker.core.threshold.ThresholdPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit Breaker 엔진 구현체.
 *
 * <p>상태 머신, 카운터, 임계값 정책, 두 개의 타이머를 조합하여
 * 동시 호출 환경에서 실행 허용 여부를 결정합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>취소 신호 확인 (이미 취소된 경우 사유를 던짐, 호출 실행 안 함)</li>
 *   <li>상태 확인
 *     <ul>
 *       <li>OPEN: rejection 통지 후 {@link CircuitOpenException}</li>
 *       <li>HALF_OPEN: 실행 lock 획득 (시험 호출을 한 번에 하나씩 직렬화, 거부 대신 대기)</li>
 *       <li>CLOSED: 추가 lock 없이 진행</li>
 *     </ul>
 *   </li>
 *   <li>보호 대상 호출 실행 (결과/예외 그대로 전파)</li>
 *   <li>실패 분류 → 카운터 갱신 → 정책 평가 → 필요 시 상태 전이</li>
 * </ol>
 *
 * <p><strong>타이머:</strong></p>
 * <ul>
 *   <li>open 타이머: OPEN 진입 후 timeout 경과 시 HALF_OPEN으로 전이 (OPEN 진입마다 재설정)</li>
 *   <li>reset 타이머: CLOSED 진입 후 resetTimeout 경과 시 여전히 CLOSED이면 카운터 초기화
 *       (resetTimeout이 ZERO이면 비활성)</li>
 * </ul>
 *
 * <p><strong>Lock 순서:</strong> 실행 lock → 상태 전이 lock → 타이머/카운터 lock.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final BreakerSettings settings;
    private final ConsecutiveCounter consecutiveCounter;
    private final RollingWindowCounter rollingWindow;
    private final BreakerEventPublisher eventPublisher;
    private final ReentrantLock executionLock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final BreakerTimer openTimer;
    private final BreakerTimer resetTimer;
    private final StateMachine stateMachine;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * 생성자 (시스템 시계, 전용 scheduler).
     *
     * @param settings 설정
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public DefaultCircuitBreaker(BreakerSettings settings) {
        this(settings, Clock.systemUTC(), null);
    }

    /**
     * 생성자.
     *
     * <p>scheduler를 null로 전달하면 breaker 전용 단일 스레드 scheduler를 생성하며,
     * {@link #shutdown()} 시 함께 종료합니다. 외부 scheduler는 종료하지 않습니다.</p>
     *
     * @param settings 설정
     * @param clock 상태 변경 시각과 Rolling window의 시각 기준
     * @param scheduler 타이머 scheduler (null 허용)
     * @throws IllegalArgumentException settings 또는 clock이 null인 경우
     */
    public DefaultCircuitBreaker(BreakerSettings settings, Clock clock, ScheduledExecutorService scheduler) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.settings = settings;
        this.name = settings.name();
        this.eventPublisher = new BreakerEventPublisher();
        this.consecutiveCounter = new ConsecutiveCounter();
        this.rollingWindow = settings.failureThreshold().usesRollingWindow()
            ? new RollingWindowCounter(settings.rollingWindow(), settings.rollingWindowBuckets(), clock)
            : null;

        this.ownsScheduler = scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler(name) : scheduler;
        this.openTimer = new BreakerTimer(name + "-open", this.scheduler);
        this.resetTimer = new BreakerTimer(name + "-reset", this.scheduler);

        this.stateMachine = new StateMachine(clock, this::onTransition);

        armResetTimer();

        log.debug("Circuit breaker '{}' created (policy: {}, timeout: {}, resetTimeout: {})",
            name, settings.failureThreshold().name(), settings.timeout(), settings.resetTimeout());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerState getState() {
        return stateMachine.getState();
    }

    public BreakerSettings getSettings() {
        return settings;
    }

    ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    @Override
    public BreakerEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    @Override
    public <T> T execute(CancellationSignal signal, CancellableOperation<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        CancellationSignal effective = signal == null ? CancellationSignal.none() : signal;

        // 1. 진입 시점 취소 확인 (lock 획득 전)
        effective.throwIfCancelled();

        // 2. 상태에 따른 진입 제어
        CircuitBreakerState state = stateMachine.getState();
        if (state == CircuitBreakerState.OPEN) {
            eventPublisher.publishRejection(name);
            throw new CircuitOpenException(name);
        }

        boolean probe = state == CircuitBreakerState.HALF_OPEN;
        if (probe) {
            executionLock.lockInterruptibly();
        }
        try {
            return invoke(effective, operation);
        } finally {
            if (probe) {
                executionLock.unlock();
            }
        }
    }

    @Override
    public BreakerMetrics getMetrics() {
        ConsecutiveCounts counts = consecutiveCounter.snapshot();

        long totalRequests;
        long totalFailures;
        if (rollingWindow != null) {
            WindowCounts window = rollingWindow.counts();
            totalRequests = window.totalRequests();
            totalFailures = window.totalFailures();
        } else {
            totalRequests = counts.totalRequests();
            totalFailures = counts.totalFailures();
        }

        return new BreakerMetrics(
            name,
            stateMachine.getState(),
            totalRequests,
            totalFailures,
            counts.consecutiveFailures(),
            counts.consecutiveSuccesses(),
            stateMachine.getLastStateChange(),
            stateMachine.getTimeInState()
        );
    }

    @Override
    public void reset() {
        stateMachine.transitionTo(CircuitBreakerState.CLOSED);
        resetCounters();
        armResetTimer();
        log.info("Circuit breaker '{}' manually reset", name);
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        openTimer.close();
        resetTimer.close();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.debug("Circuit breaker '{}' shut down", name);
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * 보호 대상 호출 실행 및 결과 기록.
     */
    private <T> T invoke(CancellationSignal signal, CancellableOperation<T> operation) throws Exception {
        T result;
        try {
            result = operation.call(signal);
        } catch (Exception e) {
            if (isFailure(e)) {
                recordFailure(e);
            }
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * 실패 분류.
     *
     * <ol>
     *   <li>failurePredicate가 있으면 그 판정을 따름</li>
     *   <li>ignoredErrors에 동일 인스턴스가 있으면 실패 아님</li>
     *   <li>ignoredExceptionTypes의 인스턴스이면 실패 아님</li>
     *   <li>그 외 모든 예외는 실패</li>
     * </ol>
     */
    boolean isFailure(Throwable error) {
        if (error == null) {
            return false;
        }
        if (settings.failurePredicate() != null) {
            return settings.failurePredicate().test(error);
        }
        for (Throwable ignored : settings.ignoredErrors()) {
            if (ignored == error) {
                return false;
            }
        }
        for (Class<? extends Throwable> type : settings.ignoredExceptionTypes()) {
            if (type.isInstance(error)) {
                return false;
            }
        }
        return true;
    }

    private void recordSuccess() {
        eventPublisher.publishSuccess(name);

        consecutiveCounter.recordSuccess();
        if (rollingWindow != null) {
            rollingWindow.recordSuccess();
        }

        if (stateMachine.isHalfOpen()
            && consecutiveCounter.getConsecutiveSuccesses() >= settings.successThreshold()
            && stateMachine.compareAndTransition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED)) {
            resetCounters();
            armResetTimer();
        }
    }

    private void recordFailure(Exception error) {
        eventPublisher.publishFailure(name, error);

        consecutiveCounter.recordFailure();
        if (rollingWindow != null) {
            rollingWindow.recordFailure();
        }

        CircuitBreakerState current = stateMachine.getState();

        // HALF_OPEN 실패 1회 → 즉시 OPEN
        if (current == CircuitBreakerState.HALF_OPEN) {
            stateMachine.compareAndTransition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN);
            return;
        }

        if (current == CircuitBreakerState.CLOSED
            && shouldTrip()
            && stateMachine.compareAndTransition(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN)) {
            eventPublisher.publishTrip(name, error);
        }
    }

    private boolean shouldTrip() {
        ThresholdPolicy policy = settings.failureThreshold();

        if (policy.usesRollingWindow()) {
            WindowCounts counts = rollingWindow.counts();
            if (counts.totalRequests() < settings.minimumRequestVolume()) {
                return false;
            }
            return policy.shouldTrip(
                counts.totalFailures(), counts.totalSuccesses(), counts.totalRequests(), settings.rollingWindow()
            );
        }

        ConsecutiveCounts counts = consecutiveCounter.snapshot();
        return policy.shouldTrip(
            counts.consecutiveFailures(), counts.consecutiveSuccesses(), counts.totalRequests(), settings.rollingWindow()
        );
    }

    /**
     * 상태 전이 Hook (상태 전이 lock 보유 상태에서 호출됨).
     */
    private void onTransition(CircuitBreakerState from, CircuitBreakerState to) {
        log.debug("Circuit breaker '{}' transition: {} -> {}", name, from, to);

        eventPublisher.publishStateChange(name, from, to);
        if (from == CircuitBreakerState.CLOSED && to == CircuitBreakerState.OPEN) {
            eventPublisher.publishTrip(name, null);
        } else if (to == CircuitBreakerState.CLOSED) {
            eventPublisher.publishReset(name);
        }

        if (from == CircuitBreakerState.CLOSED) {
            resetTimer.cancel();
        }

        if (to == CircuitBreakerState.OPEN) {
            openTimer.schedule(settings.timeout(), this::onOpenTimeout);
        } else if (to == CircuitBreakerState.CLOSED) {
            openTimer.cancel();
            armResetTimer();
        }
    }

    private void onOpenTimeout() {
        if (stateMachine.compareAndTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN)) {
            log.debug("Circuit breaker '{}' open timeout elapsed, probing", name);
        }
    }

    private void onResetTimeout() {
        executionLock.lock();
        try {
            if (stateMachine.isClosed()) {
                resetCounters();
                log.debug("Circuit breaker '{}' reset timeout elapsed, counters cleared", name);
            }
        } finally {
            executionLock.unlock();
        }
    }

    private void armResetTimer() {
        if (settings.isResetTimeoutEnabled()) {
            resetTimer.schedule(settings.resetTimeout(), this::onResetTimeout);
        }
    }

    private void resetCounters() {
        consecutiveCounter.reset();
        if (rollingWindow != null) {
            rollingWindow.reset();
        }
    }

    private static ScheduledExecutorService newScheduler(String name) {
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "breaker-timer-" + name);
            thread.setDaemon(true);
            return thread;
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        // re-armed timers leave their cancelled predecessors in the queue otherwise
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public String toString() {
        return "DefaultCircuitBreaker{name=" + name + ", state=" + stateMachine.getState() + '}';
    }
}
