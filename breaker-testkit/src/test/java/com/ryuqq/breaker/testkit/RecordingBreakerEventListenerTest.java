package com.ryuqq.breaker.testkit;

import com.ryuqq.breaker.core.event.BreakerEventPublisher;
import com.ryuqq.breaker.core.protection.CircuitBreakerState;
import com.ryuqq.breaker.testkit.RecordingBreakerEventListener.Kind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordingBreakerEventListener 테스트.
 *
 * <p>BreakerEventPublisher에 등록되었을 때 모든 이벤트 종류를 발생 순서대로 기록하는지 확인합니다.</p>
 */
class RecordingBreakerEventListenerTest {

    @Test
    void publisher_이벤트를_순서대로_기록한다() {
        // Given
        BreakerEventPublisher publisher = new BreakerEventPublisher();
        RecordingBreakerEventListener events = new RecordingBreakerEventListener();
        publisher.addListener(events);
        RuntimeException error = new RuntimeException("boom");

        // When
        publisher.publishFailure("api", error);
        publisher.publishStateChange("api", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        publisher.publishTrip("api", error);
        publisher.publishRejection("api");
        publisher.publishSuccess("api");
        publisher.publishReset("api");

        // Then
        List<Kind> kinds = events.events().stream().map(RecordingBreakerEventListener.Event::kind).toList();
        assertEquals(List.of(Kind.FAILURE, Kind.STATE_CHANGE, Kind.TRIP, Kind.REJECTION, Kind.SUCCESS, Kind.RESET),
            kinds);
        assertSame(error, events.eventsOf(Kind.TRIP).get(0).error());
        assertEquals(List.of(new RecordingBreakerEventListener.StateChange(
            "api", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN)), events.stateChanges());
    }

    @Test
    void clear_이후에는_비어있다() {
        RecordingBreakerEventListener events = new RecordingBreakerEventListener();
        events.onSuccess("api");
        events.onRejection("api");

        events.clear();

        assertTrue(events.events().isEmpty());
        assertEquals(0, events.count(Kind.SUCCESS));
    }

    @Test
    void 동시_기록에서도_이벤트를_잃지_않는다() throws Exception {
        // Given
        RecordingBreakerEventListener events = new RecordingBreakerEventListener();
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        events.onFailure("api", null);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }

        // Then
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, events.count(Kind.FAILURE));
    }
}
