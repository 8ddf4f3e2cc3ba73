package com.ryuqq.breaker.core.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 기한 기반 취소 신호.
 *
 * <p>기한 시각이 지나면 취소된 것으로 간주하며,
 * 사유는 {@link DeadlineExceededException}입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Deadline deadline = Deadline.after(Duration.ofMillis(500));
 * String body = breaker.execute(deadline, signal -> client.get(url, signal));
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class Deadline implements CancellationSignal {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    /**
     * 현재 시각으로부터 timeout 이후 만료되는 Deadline 생성.
     *
     * @param timeout 제한 시간
     * @return Deadline
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    /**
     * 지정한 시계 기준으로 timeout 이후 만료되는 Deadline 생성.
     *
     * @param timeout 제한 시간
     * @param clock 시각 기준
     * @return Deadline
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우, clock이 null인 경우
     */
    public static Deadline after(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    /**
     * 남은 시간.
     *
     * @return 만료까지 남은 시간 (만료된 경우 Duration.ZERO)
     */
    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean isCancelled() {
        return !clock.instant().isBefore(expiresAt);
    }

    @Override
    public Exception cause() {
        if (!isCancelled()) {
            return null;
        }
        return new DeadlineExceededException(expiresAt);
    }
}
