package com.ryuqq.breaker.core.execution;

import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * {@link Deadline} 만료 사유.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class DeadlineExceededException extends TimeoutException {

    private static final long serialVersionUID = 1L;

    private final Instant expiredAt;

    public DeadlineExceededException(Instant expiredAt) {
        super("deadline exceeded at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
