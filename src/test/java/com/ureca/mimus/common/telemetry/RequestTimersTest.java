package com.ureca.mimus.common.telemetry;

import com.ureca.mimus.support.fake.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RequestTimers 단위 테스트")
class RequestTimersTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final RequestTimers timers = new RequestTimers(clock);

    @Test
    @DisplayName("start 는 절대 시각, stop 은 경과 시간")
    void startStop_RecordsElapsedSeconds() {
        // given
        timers.start(RequestTimers.COMMIT);
        assertThat(timers.get(RequestTimers.COMMIT)).isEqualTo(clock.millis() / 1000.0);

        // when
        clock.advance(Duration.ofMillis(1500));
        timers.stop(RequestTimers.COMMIT);

        // then
        assertThat(timers.get(RequestTimers.COMMIT)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    @DisplayName("epoch 초 단위 double 오차 없이 ms 단위 경과 시간이 그대로 나온다")
    void stop_ElapsedMillisExact() {
        // given
        clock.advanceMillis(777);
        timers.start(RequestTimers.ACK);

        // when
        clock.advanceMillis(123);
        timers.stop(RequestTimers.ACK);

        // then
        assertThat(timers.get(RequestTimers.ACK)).isEqualTo(0.123);
    }

    @Test
    @DisplayName("시작하지 않은 타이머 stop 은 무시")
    void stop_WithoutStart_Ignored() {
        timers.stop(RequestTimers.ACK);

        assertThat(timers.get(RequestTimers.ACK)).isNull();
    }

    @Test
    @DisplayName("두 번 stop 해도 값이 바뀌지 않는다")
    void stop_Twice_KeepsFirstValue() {
        // given
        timers.start(RequestTimers.ACK);
        clock.advance(Duration.ofMillis(200));
        timers.stop(RequestTimers.ACK);

        // when
        clock.advance(Duration.ofSeconds(5));
        timers.stop(RequestTimers.ACK);

        // then
        assertThat(timers.get(RequestTimers.ACK)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("발행용 스냅샷은 진행 중인 내부 구간만 제외")
    void publishableSnapshot_ExcludesRunningInternalTimers() {
        // given
        timers.start(RequestTimers.WORKER_PROCESSING);
        timers.start(RequestTimers.PULL_WAIT);
        timers.stop(RequestTimers.PULL_WAIT);
        timers.start(RequestTimers.STORE_WRITE);
        timers.put(RequestTimers.TOTAL, 1_000.0, true);

        // when & then
        assertThat(timers.publishableSnapshot()).containsOnlyKeys(
                RequestTimers.PULL_WAIT, RequestTimers.STORE_WRITE, RequestTimers.TOTAL);
        assertThat(timers.publishableSnapshot().get(RequestTimers.TOTAL)).isEqualTo(1_000.0);
    }

    @Test
    @DisplayName("스냅샷은 이름 순 (= 처리 순서)")
    void snapshot_SortedByName() {
        // given
        timers.put(RequestTimers.TOTAL, 1.0);
        timers.put(RequestTimers.QUEUE_WAIT, 0.1);
        timers.put("100 SELECT 123 srv:1", 0.2);
        timers.put(RequestTimers.COMMIT, 0.3);

        // when & then
        assertThat(timers.snapshot().keySet()).containsExactly(
                RequestTimers.QUEUE_WAIT, "100 SELECT 123 srv:1", RequestTimers.COMMIT, RequestTimers.TOTAL);
    }

    @Test
    @DisplayName("출력 이름은 순서 숫자 제거, 괄호는 내부 구간")
    void displayNameAndInternal() {
        assertThat(RequestTimers.displayName(RequestTimers.QUEUE_WAIT)).isEqualTo("q wait");
        assertThat(RequestTimers.displayName(RequestTimers.ROUNDTRIP)).isEqualTo("SQL roundtrip");
        assertThat(RequestTimers.isInternal(RequestTimers.PULL_WAIT)).isTrue();
        assertThat(RequestTimers.isInternal(RequestTimers.ACK_CHECK)).isFalse();
    }
}
