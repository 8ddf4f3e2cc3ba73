package com.ryuqq.breaker.testkit;

import com.ryuqq.breaker.core.event.BreakerEventListener;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 수신한 이벤트를 순서대로 기록하는 테스트용 listener.
 *
 * <p>모든 이벤트는 단일 리스트에 발생 순서대로 쌓이며, 여러 스레드에서 동시에 기록해도 안전합니다.</p>
 *
 * <pre>{@code
 * RecordingBreakerEventListener events = new RecordingBreakerEventListener();
 * breaker.getEventPublisher().addListener(events);
 *
 * // ...
 * assertThat(events.stateChanges()).containsExactly(
 *     new StateChange("api", CLOSED, OPEN));
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class RecordingBreakerEventListener implements BreakerEventListener {

    /**
     * 기록된 이벤트 종류.
     */
    public enum Kind {
        STATE_CHANGE, TRIP, RESET, SUCCESS, FAILURE, REJECTION
    }

    /**
     * 기록된 이벤트 한 건.
     *
     * @param kind 이벤트 종류
     * @param name breaker 이름
     * @param from 이전 상태 (상태 전이 이벤트만)
     * @param to 이후 상태 (상태 전이 이벤트만)
     * @param error 관련 예외 (trip, failure만, null 허용)
     */
    public record Event(Kind kind, String name, CircuitBreakerState from, CircuitBreakerState to, Throwable error) {
    }

    /**
     * 상태 전이 한 건.
     */
    public record StateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
    }

    private final List<Event> events = new CopyOnWriteArrayList<>();

    @Override
    public void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        events.add(new Event(Kind.STATE_CHANGE, name, from, to, null));
    }

    @Override
    public void onTrip(String name, Throwable cause) {
        events.add(new Event(Kind.TRIP, name, null, null, cause));
    }

    @Override
    public void onReset(String name) {
        events.add(new Event(Kind.RESET, name, null, null, null));
    }

    @Override
    public void onSuccess(String name) {
        events.add(new Event(Kind.SUCCESS, name, null, null, null));
    }

    @Override
    public void onFailure(String name, Throwable cause) {
        events.add(new Event(Kind.FAILURE, name, null, null, cause));
    }

    @Override
    public void onRejection(String name) {
        events.add(new Event(Kind.REJECTION, name, null, null, null));
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<Event> eventsOf(Kind kind) {
        List<Event> result = new ArrayList<>();
        for (Event event : events) {
            if (event.kind() == kind) {
                result.add(event);
            }
        }
        return result;
    }

    public List<StateChange> stateChanges() {
        List<StateChange> result = new ArrayList<>();
        for (Event event : eventsOf(Kind.STATE_CHANGE)) {
            result.add(new StateChange(event.name(), event.from(), event.to()));
        }
        return result;
    }

    public int count(Kind kind) {
        return eventsOf(kind).size();
    }

    public void clear() {
        events.clear();
    }
}
