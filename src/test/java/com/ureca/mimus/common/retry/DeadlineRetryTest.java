package com.ureca.mimus.common.retry;

import com.ureca.mimus.support.fake.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeadlineRetry 단위 테스트")
class DeadlineRetryTest {

    private static final RetrySettings LOOKUP = new RetrySettings(
            Duration.ofMillis(100), 2.0, Duration.ofMillis(2500), Duration.ofSeconds(30));

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = millis -> {
        sleeps.add(millis);
        clock.advanceMillis(millis);
    };

    @Test
    @DisplayName("성공 : 실패 후 재시도, 대기는 100ms 부터 두 배씩")
    void execute_SucceedsAfterFailures() {
        // given
        RetryTemplate template = DeadlineRetry.template(LOOKUP, clock, recordingSleeper, List.of());
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = template.execute(context -> {
            if (attempts.incrementAndGet() < 4) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        });

        // then
        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(4);
        assertThat(sleeps).containsExactly(100L, 200L, 400L);
    }

    @Test
    @DisplayName("마감 : 대기는 2500ms 상한, 마지막 대기는 남은 시간으로 잘려 정확히 30초에 끝난다")
    void execute_NeverSucceeds_StopsAtDeadline() {
        // given
        RetryTemplate template = DeadlineRetry.template(LOOKUP, clock, recordingSleeper, List.of());
        Instant start = clock.instant();
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = template.execute(
                context -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("never");
                },
                context -> "recovered");

        // then
        assertThat(result).isEqualTo("recovered");
        assertThat(sleeps).startsWith(100L, 200L, 400L, 800L, 1600L, 2500L);
        assertThat(sleeps).allSatisfy(sleep -> assertThat(sleep).isBetween(1L, 2500L));
        assertThat(sleeps.get(sleeps.size() - 1)).isEqualTo(1900L);
        assertThat(sleeps.stream().mapToLong(Long::longValue).sum()).isEqualTo(30_000L);
        assertThat(Duration.between(start, clock.instant())).isEqualTo(Duration.ofSeconds(30));
        assertThat(attempts).hasValue(sleeps.size() + 1);
    }

    @Test
    @DisplayName("마감 : 마감 시각에 끝나는 마지막 대기 뒤 한 번 더 시도하고, 그 시도는 성공할 수 있다")
    void execute_SucceedsOnAttemptAtDeadline() {
        // given
        RetryTemplate template = DeadlineRetry.template(LOOKUP, clock, recordingSleeper, List.of());
        Instant start = clock.instant();
        Instant availableAt = start.plusMillis(29_500);
        List<Long> attemptOffsets = new ArrayList<>();

        // when
        String result = template.execute(
                context -> {
                    attemptOffsets.add(Duration.between(start, clock.instant()).toMillis());
                    if (clock.instant().isBefore(availableAt)) {
                        throw new IllegalStateException("not yet");
                    }
                    return "done";
                },
                context -> "recovered");

        // then
        assertThat(result).isEqualTo("done");
        assertThat(attemptOffsets).endsWith(28_100L, 30_000L);
        assertThat(Duration.between(start, clock.instant())).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("재시도 불가 예외는 즉시 종료")
    void execute_NonRetryable_FailsImmediately() {
        // given
        RetryTemplate template = DeadlineRetry.template(
                LOOKUP, clock, recordingSleeper, List.of(IllegalArgumentException.class));
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> template.execute(context -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("배수는 1 이상")
    void settings_RejectsShrinkingMultiplier() {
        assertThatThrownBy(() -> new RetrySettings(Duration.ofMillis(100), 0.5, Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
