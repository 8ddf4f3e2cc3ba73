package com.ryuqq.breaker.core.execution;

import java.util.concurrent.CancellationException;

/**
 * 호출자의 취소/기한 신호.
 *
 * <p>Circuit Breaker는 진입 시점에 한 번 {@link #isCancelled()}를 확인하고,
 * 이미 취소된 경우 보호 대상 호출을 실행하지 않고 {@link #cause()}를 던집니다.
 * 실행 중의 취소는 협조적(cooperative)입니다. 보호 대상 호출이 직접 신호를 확인해야 합니다.</p>
 *
 * <ul>
 *   <li>{@link #none()}: 취소되지 않는 신호</li>
 *   <li>{@link Deadline}: 기한 기반 신호</li>
 *   <li>{@link CancellationSource}: 수동 취소 신호</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CancellationSignal {

    /**
     * 취소 여부.
     *
     * @return 취소(또는 기한 초과)된 경우 true
     */
    boolean isCancelled();

    /**
     * 취소 사유.
     *
     * @return 취소 사유 예외, 취소되지 않았으면 null
     */
    Exception cause();

    /**
     * 취소된 경우 사유 예외를 던짐.
     *
     * @throws Exception 취소 사유
     */
    default void throwIfCancelled() throws Exception {
        if (!isCancelled()) {
            return;
        }
        Exception cause = cause();
        throw cause != null ? cause : new CancellationException("operation cancelled");
    }

    /**
     * 절대 취소되지 않는 신호.
     *
     * @return 취소되지 않는 신호
     */
    static CancellationSignal none() {
        return NoCancellation.INSTANCE;
    }

    /**
     * 취소되지 않는 신호 구현.
     */
    enum NoCancellation implements CancellationSignal {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Exception cause() {
            return null;
        }
    }
}
