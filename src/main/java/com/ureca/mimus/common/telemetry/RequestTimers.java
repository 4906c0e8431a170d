package com.ureca.mimus.common.telemetry;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 요청 하나의 구간별 소요 시간 기록
 * <p>
 * 요청마다 새로 만들어 호출 체인으로 전달 (프로세스 전역 상태 없음)
 * start() 는 절대 시각(epoch 초)을 기록하고, stop() 은 이를 경과 시간(초)으로 바꾼다
 * 이름 앞의 숫자는 출력 순서용 (예: "010 q wait", "800 commit")
 * 괄호로 감싼 이름은 워커 내부 구간, 프런트 쪽 진단 출력에서는 제외
 * <p>
 * 스레드 안전하지 않음 - 한 요청은 한 스레드에서만 처리
 */
public class RequestTimers {

    public static final String QUEUE_WAIT = "010 q wait";
    public static final String PULL_WAIT = "020 (pull wait)";
    public static final String JSON_LOAD = "050 json_load";
    public static final String COMMIT = "800 commit";
    public static final String ACK = "801 ack";
    public static final String STORE_WRITE = "802 redis ack";
    public static final String ACK_CHECK = "803 ack check";
    public static final String TOTAL = "900 ===TOTAL===";
    public static final String WORKER_PROCESSING = "910 (===WORKER PROCESSING===)";
    public static final String ROUNDTRIP = "999 SQL roundtrip";

    private static final int ORDER_PREFIX_LENGTH = 4;

    private final Clock clock;
    private final SortedMap<String, Double> timers = new TreeMap<>();
    private final Set<String> running = new HashSet<>();
    // start() 로 시작한 구간의 시작 시각 (ms), 경과 시간은 ms 차이로 계산
    private final Map<String, Long> startedAtMillis = new HashMap<>();

    public RequestTimers(Clock clock) {
        this.clock = clock;
    }

    // 절대 시각 기록
    public void start(String name) {
        long nowMillis = clock.millis();
        timers.put(name, nowMillis / 1000.0);
        startedAtMillis.put(name, nowMillis);
        running.add(name);
    }

    // 기록된 시작 시각을 경과 시간으로 교체
    public void stop(String name) {
        Double startedAt = timers.get(name);
        if (startedAt == null || !running.remove(name)) {
            return;
        }
        Long startMillis = startedAtMillis.remove(name);
        timers.put(name, startMillis != null
                ? (clock.millis() - startMillis) / 1000.0
                : now() - startedAt);
    }

    // 다른 프로세스에서 시작된 구간 등 값을 직접 지정 (running 이면 절대 시각으로 취급)
    public void put(String name, double seconds, boolean running) {
        timers.put(name, seconds);
        startedAtMillis.remove(name);
        if (running) {
            this.running.add(name);
        } else {
            this.running.remove(name);
        }
    }

    public void put(String name, double seconds) {
        put(name, seconds, false);
    }

    public Double get(String name) {
        return timers.get(name);
    }

    public double now() {
        return clock.millis() / 1000.0;
    }

    /**
     * 결과 봉투에 실어 보낼 타이머
     * 아직 진행 중인 워커 내부 구간(괄호)은 절대 시각이므로 제외
     */
    public SortedMap<String, Double> publishableSnapshot() {
        SortedMap<String, Double> snapshot = new TreeMap<>();
        timers.forEach((name, value) -> {
            if (!(running.contains(name) && isInternal(name))) {
                snapshot.put(name, value);
            }
        });
        return snapshot;
    }

    public Map<String, Double> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(timers));
    }

    public static boolean isInternal(String name) {
        return name.contains("(");
    }

    // 출력용 이름 (순서 숫자 제거)
    public static String displayName(String name) {
        return name.length() > ORDER_PREFIX_LENGTH ? name.substring(ORDER_PREFIX_LENGTH) : name;
    }
}
