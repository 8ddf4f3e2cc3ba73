package com.ryuqq.breaker.core.event;

import com.ryuqq.breaker.core.protection.CircuitBreakerState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Circuit Breaker 이벤트 발행기.
 *
 * <p>이벤트 종류별로 0개 이상의 observer를 등록할 수 있으며,
 * observer는 등록 순서대로, 이벤트를 발생시킨 스레드에서 동기적으로 호출됩니다.</p>
 *
 * <p><strong>격리 없음:</strong> observer가 블로킹하거나 예외를 던지면 그대로 호출자에게 영향을 줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * breaker.getEventPublisher()
 *     .onStateChange((name, from, to) -> metrics.gauge(name, to))
 *     .onRejection(name -> rejected.increment());
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class BreakerEventPublisher {

    private final List<StateChangeCallback> stateChangeCallbacks = new CopyOnWriteArrayList<>();
    private final List<TripCallback> tripCallbacks = new CopyOnWriteArrayList<>();
    private final List<NameCallback> resetCallbacks = new CopyOnWriteArrayList<>();
    private final List<NameCallback> successCallbacks = new CopyOnWriteArrayList<>();
    private final List<FailureCallback> failureCallbacks = new CopyOnWriteArrayList<>();
    private final List<NameCallback> rejectionCallbacks = new CopyOnWriteArrayList<>();

    /**
     * 상태 전이 observer.
     */
    @FunctionalInterface
    public interface StateChangeCallback {
        void accept(String name, CircuitBreakerState from, CircuitBreakerState to);
    }

    /**
     * trip observer.
     */
    @FunctionalInterface
    public interface TripCallback {
        void accept(String name, Throwable cause);
    }

    /**
     * 실패 observer.
     */
    @FunctionalInterface
    public interface FailureCallback {
        void accept(String name, Throwable cause);
    }

    /**
     * 이름만 전달받는 observer (reset, success, rejection).
     */
    @FunctionalInterface
    public interface NameCallback {
        void accept(String name);
    }

    public BreakerEventPublisher onStateChange(StateChangeCallback callback) {
        stateChangeCallbacks.add(requireCallback(callback));
        return this;
    }

    public BreakerEventPublisher onTrip(TripCallback callback) {
        tripCallbacks.add(requireCallback(callback));
        return this;
    }

    public BreakerEventPublisher onReset(NameCallback callback) {
        resetCallbacks.add(requireCallback(callback));
        return this;
    }

    public BreakerEventPublisher onSuccess(NameCallback callback) {
        successCallbacks.add(requireCallback(callback));
        return this;
    }

    public BreakerEventPublisher onFailure(FailureCallback callback) {
        failureCallbacks.add(requireCallback(callback));
        return this;
    }

    public BreakerEventPublisher onRejection(NameCallback callback) {
        rejectionCallbacks.add(requireCallback(callback));
        return this;
    }

    /**
     * 모든 이벤트 종류에 Sink를 등록.
     *
     * @param listener 이벤트 Sink
     * @return this
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public BreakerEventPublisher addListener(BreakerEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        stateChangeCallbacks.add(listener::onStateChange);
        tripCallbacks.add(listener::onTrip);
        resetCallbacks.add(listener::onReset);
        successCallbacks.add(listener::onSuccess);
        failureCallbacks.add(listener::onFailure);
        rejectionCallbacks.add(listener::onRejection);
        return this;
    }

    public void publishStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        for (StateChangeCallback callback : stateChangeCallbacks) {
            callback.accept(name, from, to);
        }
    }

    public void publishTrip(String name, Throwable cause) {
        for (TripCallback callback : tripCallbacks) {
            callback.accept(name, cause);
        }
    }

    public void publishReset(String name) {
        for (NameCallback callback : resetCallbacks) {
            callback.accept(name);
        }
    }

    public void publishSuccess(String name) {
        for (NameCallback callback : successCallbacks) {
            callback.accept(name);
        }
    }

    public void publishFailure(String name, Throwable cause) {
        for (FailureCallback callback : failureCallbacks) {
            callback.accept(name, cause);
        }
    }

    public void publishRejection(String name) {
        for (NameCallback callback : rejectionCallbacks) {
            callback.accept(name);
        }
    }

    private static <C> C requireCallback(C callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        return callback;
    }
}
