package com.ryuqq.breaker.core.counter;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 성공/실패 카운터.
 *
 * <p>끊기지 않은 연속 성공/실패 횟수와 누적 합계를 추적합니다.
 * 반대 종류의 결과가 기록되면 연속 횟수는 0으로 초기화됩니다.</p>
 *
 * <p><strong>불변식:</strong> consecutiveSuccesses와 consecutiveFailures 중
 * 최대 하나만 0이 아닙니다. 누적 합계는 {@link #reset()} 외에는 감소하지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class ConsecutiveCounter {

    private final ReentrantLock lock = new ReentrantLock();

    private long consecutiveSuccesses;
    private long consecutiveFailures;
    private long totalSuccesses;
    private long totalFailures;

    /**
     * 성공 기록.
     */
    public void recordSuccess() {
        lock.lock();
        try {
            consecutiveSuccesses++;
            consecutiveFailures = 0;
            totalSuccesses++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 실패 기록.
     */
    public void recordFailure() {
        lock.lock();
        try {
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            totalFailures++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 값을 0으로 초기화.
     */
    public void reset() {
        lock.lock();
        try {
            consecutiveSuccesses = 0;
            consecutiveFailures = 0;
            totalSuccesses = 0;
            totalFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    public long getConsecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    public long getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 네 값을 원자적으로 조회.
     *
     * @return 현재 카운터 스냅샷
     */
    public ConsecutiveCounts snapshot() {
        lock.lock();
        try {
            return new ConsecutiveCounts(consecutiveSuccesses, consecutiveFailures, totalSuccesses, totalFailures);
        } finally {
            lock.unlock();
        }
    }
}
