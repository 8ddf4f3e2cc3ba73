package com.ryuqq.breaker.core.counter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 시간 기반 Rolling Window 카운터.
 *
 * <p>고정 길이의 윈도우를 N개의 bucket으로 나누어, 최근 윈도우 동안의
 * 요청/실패 합계를 유지합니다. 이벤트별 timestamp를 저장하지 않고 bucket 단위로
 * 오래된 데이터를 제거하여 sliding window를 근사합니다.</p>
 *
 * <p><strong>Ring buffer 구조:</strong></p>
 * <pre>
 * head ──► 현재 bucket: [anchor, anchor + bucketDuration) 구간의 이벤트 기록
 * head+1 … head+N-1 ──► 이전 bucket들 (가장 오래된 것부터)
 *
 * rotate():
 *   steps = (now - anchor) / bucketDuration
 *   min(steps, N)번 반복: head = (head + 1) % N → 해당 bucket 합계를 total에서 차감 후 0으로 초기화
 *   anchor += steps * bucketDuration (나머지는 다음 회전으로 이월)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>totalRequests ≥ totalFailures ≥ 0</li>
 *   <li>윈도우 길이 동안 활동이 없으면 두 값 모두 0으로 감소</li>
 *   <li>윈도우 밖 이벤트는 새 이벤트가 기록되기 전에 항상 제거됨</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class RollingWindowCounter {

    /**
     * bucket 수를 지정하지 않았거나 0 이하인 경우 사용하는 기본값.
     */
    public static final int DEFAULT_BUCKET_COUNT = 10;

    private static final Duration MIN_BUCKET_DURATION = Duration.ofMillis(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Duration windowDuration;
    private final long bucketNanos;
    private final long[] bucketRequests;
    private final long[] bucketFailures;

    private int head;
    private Instant anchor;
    private long totalRequests;
    private long totalFailures;

    /**
     * 생성자 (시스템 시계, 기본 bucket 수).
     *
     * @param windowDuration 윈도우 길이
     */
    public RollingWindowCounter(Duration windowDuration) {
        this(windowDuration, DEFAULT_BUCKET_COUNT, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param windowDuration 윈도우 길이 (양수여야 함)
     * @param bucketCount bucket 수 (0 이하이면 {@value #DEFAULT_BUCKET_COUNT})
     * @param clock 시각 기준
     * @throws IllegalArgumentException windowDuration이 null이거나 양수가 아닌 경우, clock이 null인 경우
     */
    public RollingWindowCounter(Duration windowDuration, int bucketCount, Clock clock) {
        if (windowDuration == null || windowDuration.isZero() || windowDuration.isNegative()) {
            throw new IllegalArgumentException("windowDuration must be positive (current: " + windowDuration + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        int buckets = bucketCount <= 0 ? DEFAULT_BUCKET_COUNT : bucketCount;

        Duration bucketDuration = windowDuration.dividedBy(buckets);
        if (bucketDuration.compareTo(MIN_BUCKET_DURATION) < 0) {
            bucketDuration = MIN_BUCKET_DURATION;
        }

        this.clock = clock;
        this.windowDuration = windowDuration;
        this.bucketNanos = bucketDuration.toNanos();
        this.bucketRequests = new long[buckets];
        this.bucketFailures = new long[buckets];
        this.head = 0;
        this.anchor = clock.instant();
    }

    /**
     * 성공 기록.
     */
    public void recordSuccess() {
        record(false);
    }

    /**
     * 실패 기록.
     */
    public void recordFailure() {
        record(true);
    }

    /**
     * 윈도우 내 요청/실패 합계 조회.
     *
     * <p>조회 전에 만료된 bucket을 제거합니다.</p>
     *
     * @return 현재 윈도우 합계
     */
    public WindowCounts counts() {
        lock.lock();
        try {
            rotate();
            return new WindowCounts(totalRequests, totalFailures);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 bucket과 합계를 0으로 초기화하고 회전 기준 시각을 현재로 재설정.
     */
    public void reset() {
        lock.lock();
        try {
            for (int i = 0; i < bucketRequests.length; i++) {
                bucketRequests[i] = 0;
                bucketFailures[i] = 0;
            }
            totalRequests = 0;
            totalFailures = 0;
            head = 0;
            anchor = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public Duration getWindowDuration() {
        return windowDuration;
    }

    public Duration getBucketDuration() {
        return Duration.ofNanos(bucketNanos);
    }

    public int getBucketCount() {
        return bucketRequests.length;
    }

    private void record(boolean failure) {
        lock.lock();
        try {
            rotate();
            bucketRequests[head]++;
            totalRequests++;
            if (failure) {
                bucketFailures[head]++;
                totalFailures++;
            }
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private void rotate() {
        long elapsedNanos = Duration.between(anchor, clock.instant()).toNanos();
        if (elapsedNanos < bucketNanos) {
            return;
        }

        long steps = elapsedNanos / bucketNanos;
        int evictions = (int) Math.min(steps, bucketRequests.length);

        for (int i = 0; i < evictions; i++) {
            head = (head + 1) % bucketRequests.length;
            totalRequests -= bucketRequests[head];
            totalFailures -= bucketFailures[head];
            bucketRequests[head] = 0;
            bucketFailures[head] = 0;
        }

        anchor = anchor.plusNanos(steps * bucketNanos);
    }
}
