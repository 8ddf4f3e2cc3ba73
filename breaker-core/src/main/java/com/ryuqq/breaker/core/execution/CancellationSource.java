package com.ryuqq.breaker.core.execution;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 수동 취소 신호.
 *
 * <p>{@link #cancel()} 호출 이후 {@link #isCancelled()}는 true를 반환합니다.
 * 첫 번째 취소 사유만 유지됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CancellationSource implements CancellationSignal {

    private final AtomicReference<Exception> cause = new AtomicReference<>();

    /**
     * 기본 사유로 취소.
     *
     * @return 이번 호출로 취소된 경우 true (이미 취소된 경우 false)
     */
    public boolean cancel() {
        return cancel("operation cancelled");
    }

    /**
     * 지정한 메시지로 취소.
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소된 경우 true (이미 취소된 경우 false)
     */
    public boolean cancel(String reason) {
        return cause.compareAndSet(null, new CancellationException(reason));
    }

    @Override
    public boolean isCancelled() {
        return cause.get() != null;
    }

    @Override
    public Exception cause() {
        return cause.get();
    }
}
