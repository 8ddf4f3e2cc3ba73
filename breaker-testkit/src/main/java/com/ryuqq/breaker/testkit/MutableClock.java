package com.ryuqq.breaker.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 수동으로 전진시키는 테스트용 Clock.
 *
 * <p>rolling window bucket 회전, OPEN 경과 시간 등 시간 의존 로직을
 * 실제 sleep 없이 검증할 때 사용합니다. 여러 스레드에서 읽어도 안전합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public MutableClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 현재 시각을 주어진 만큼 전진.
     *
     * @param duration 전진할 시간 (음수 불가)
     * @return this
     */
    public synchronized MutableClock advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        now = now.plus(duration);
        return this;
    }

    public synchronized MutableClock advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }

    public synchronized void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }
}
