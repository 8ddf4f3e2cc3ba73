package com.ryuqq.breaker.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 단발성(one-shot) 재설정 가능 타이머.
 *
 * <p>{@link #schedule(Duration, Runnable)}을 호출할 때마다 대기 중인 작업을 취소하고
 * 새 작업으로 교체합니다. {@link #close()} 이후에는 어떤 작업도 예약되거나 실행되지 않습니다.</p>
 *
 * <p><strong>예외 처리:</strong> 작업이 던진 RuntimeException은 로그로 남기고
 * scheduler 스레드로 전파하지 않습니다 (다음 예약에 영향 없음).</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
final class BreakerTimer {

    private static final Logger log = LoggerFactory.getLogger(BreakerTimer.class);

    private final String name;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> pending;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param name 타이머 이름 (로깅용)
     * @param scheduler 작업을 실행할 scheduler
     * @throws IllegalArgumentException name 또는 scheduler가 null인 경우
     */
    BreakerTimer(String name, ScheduledExecutorService scheduler) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.name = name;
        this.scheduler = scheduler;
    }

    /**
     * 작업 예약 (대기 중인 작업은 교체).
     *
     * @param delay 지연 시간
     * @param task 실행할 작업
     * @return 예약된 경우 true, 이미 close된 경우 false
     */
    synchronized boolean schedule(Duration delay, Runnable task) {
        if (closed) {
            return false;
        }
        cancelPending();
        try {
            pending = scheduler.schedule(() -> runIfOpen(task), delay.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Timer {} could not be scheduled, scheduler rejected the task", name, e);
            pending = null;
            return false;
        }
    }

    /**
     * 대기 중인 작업 취소.
     */
    synchronized void cancel() {
        cancelPending();
    }

    /**
     * 대기 중인 작업을 취소하고 이후 예약을 막음 (멱등).
     */
    synchronized void close() {
        closed = true;
        cancelPending();
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    private void runIfOpen(Runnable task) {
        if (isClosed()) {
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Timer {} task failed", name, e);
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
