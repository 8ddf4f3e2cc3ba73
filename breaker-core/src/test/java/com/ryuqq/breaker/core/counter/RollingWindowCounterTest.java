package com.ryuqq.breaker.core.counter;

import com.ryuqq.breaker.core.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RollingWindowCounter 테스트.
 *
 * <p>10초 윈도우, 1초 bucket 10개 기준으로 bucket 회전과 만료를 검증합니다.</p>
 */
@DisplayName("RollingWindowCounter 테스트")
class RollingWindowCounterTest {

    private ManualClock clock;
    private RollingWindowCounter counter;

    @BeforeEach
    void setUp() {
        clock = ManualClock.atEpoch();
        counter = new RollingWindowCounter(Duration.ofSeconds(10), 10, clock);
    }

    @Test
    void 기록은_즉시_합계에_반영된다() {
        counter.recordSuccess();
        counter.recordFailure();
        counter.recordFailure();

        WindowCounts counts = counter.counts();

        assertThat(counts.totalRequests()).isEqualTo(3);
        assertThat(counts.totalFailures()).isEqualTo(2);
        assertThat(counts.totalSuccesses()).isEqualTo(1);
    }

    @Test
    void 윈도우_길이가_지나면_모두_만료된다() {
        // given
        counter.recordFailure();
        counter.recordSuccess();

        // when
        clock.advance(Duration.ofSeconds(10));

        // then
        assertThat(counter.counts()).isEqualTo(WindowCounts.EMPTY);
    }

    @Test
    void 윈도우_직전에는_첫_bucket이_남아있다() {
        // given: t=0 에 실패 1건
        counter.recordFailure();

        // when: t=9.999s
        clock.advance(Duration.ofMillis(9_999));

        // then
        assertThat(counter.counts()).isEqualTo(new WindowCounts(1, 1));
    }

    @Test
    void 오래된_bucket만_부분적으로_만료된다() {
        // given: t=0 실패 2건, t=5s 성공 3건
        counter.recordFailure();
        counter.recordFailure();
        clock.advance(Duration.ofSeconds(5));
        counter.recordSuccess();
        counter.recordSuccess();
        counter.recordSuccess();

        // when: t=10.5s → t=0 bucket 만료, t=5s bucket 유지
        clock.advance(Duration.ofMillis(5_500));

        // then
        assertThat(counter.counts()).isEqualTo(new WindowCounts(3, 0));

        // when: t=15s → 모두 만료
        clock.advance(Duration.ofMillis(4_500));
        assertThat(counter.counts()).isEqualTo(WindowCounts.EMPTY);
    }

    @Test
    void bucket_경계_사이의_나머지_시간은_이월된다() {
        // given: t=0.6s 기록
        clock.advanceMillis(600);
        counter.recordFailure();

        // when: t=1.2s (anchor 1.0s), t=9.9s 까지는 남아있다
        clock.advanceMillis(600);
        counter.recordSuccess();
        clock.advanceMillis(8_700);
        assertThat(counter.counts()).isEqualTo(new WindowCounts(2, 1));

        // then: t=10.0s 에 t=0.6s bucket 만료
        clock.advanceMillis(100);
        assertThat(counter.counts()).isEqualTo(new WindowCounts(1, 0));
    }

    @Test
    void 윈도우의_몇_배가_지나도_안전하다() {
        counter.recordFailure();
        clock.advance(Duration.ofHours(3));

        counter.recordSuccess();

        assertThat(counter.counts()).isEqualTo(new WindowCounts(1, 0));
    }

    @Test
    void reset은_모든_bucket을_비운다() {
        counter.recordFailure();
        clock.advanceMillis(2_500);
        counter.recordFailure();

        counter.reset();

        assertThat(counter.counts()).isEqualTo(WindowCounts.EMPTY);
        counter.recordSuccess();
        assertThat(counter.counts()).isEqualTo(new WindowCounts(1, 0));
    }

    @Test
    void bucket_수가_0_이하이면_기본값() {
        RollingWindowCounter defaults = new RollingWindowCounter(Duration.ofSeconds(10), 0, clock);

        assertThat(defaults.getBucketCount()).isEqualTo(RollingWindowCounter.DEFAULT_BUCKET_COUNT);
        assertThat(defaults.getBucketDuration()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void bucket_길이는_최소_1ms() {
        RollingWindowCounter tiny = new RollingWindowCounter(Duration.ofNanos(500), 10, clock);

        assertThat(tiny.getBucketDuration()).isEqualTo(Duration.ofMillis(1));
        assertThat(tiny.getWindowDuration()).isEqualTo(Duration.ofNanos(500));
    }

    @Test
    void 윈도우_길이는_양수여야_한다() {
        assertThatThrownBy(() -> new RollingWindowCounter(Duration.ZERO, 10, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingWindowCounter(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
