package com.ryuqq.breaker.core.execution;

import com.ryuqq.breaker.core.support.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineTest {

    @Test
    void 만료_전에는_취소되지_않는다() throws Exception {
        ManualClock clock = ManualClock.atEpoch();
        Deadline deadline = Deadline.after(Duration.ofSeconds(2), clock);

        clock.advanceMillis(1_999);

        assertThat(deadline.isCancelled()).isFalse();
        assertThat(deadline.cause()).isNull();
        assertThat(deadline.remaining()).isEqualTo(Duration.ofMillis(1));
        deadline.throwIfCancelled();
    }

    @Test
    void 만료_시각에_도달하면_DeadlineExceededException() {
        // given
        ManualClock clock = ManualClock.atEpoch();
        Deadline deadline = Deadline.after(Duration.ofSeconds(2), clock);

        // when
        clock.advance(Duration.ofSeconds(3));

        // then
        assertThat(deadline.isCancelled()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(deadline::throwIfCancelled)
            .isInstanceOf(DeadlineExceededException.class)
            .satisfies(e -> assertThat(((DeadlineExceededException) e).getExpiredAt())
                .isEqualTo(deadline.getExpiresAt()));
    }

    @Test
    void 음수_timeout은_거부() {
        assertThatThrownBy(() -> Deadline.after(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
