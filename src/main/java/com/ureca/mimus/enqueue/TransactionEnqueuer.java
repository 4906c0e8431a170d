package com.ureca.mimus.enqueue;

import com.ureca.mimus.bus.MessageBus;
import com.ureca.mimus.common.retry.DeadlineRetry;
import com.ureca.mimus.common.telemetry.RequestTimers;
import com.ureca.mimus.config.EnqueueProperties;
import com.ureca.mimus.enqueue.exception.LookupTimeoutException;
import com.ureca.mimus.enqueue.exception.ResultNotReadyException;
import com.ureca.mimus.store.CorrelationStore;
import com.ureca.mimus.transaction.TransactionCodec;
import com.ureca.mimus.transaction.dto.QueryBatch;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import com.ureca.mimus.transaction.dto.TransactionEnvelope;
import com.ureca.mimus.transaction.exception.TransactionSerializationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 쿼리 배치를 버스에 발행하고 결과 저장소를 폴링해서 결과를 기다린다
 * <p>
 * 1. 발행: 본문 {"queries": [...]}, 속성 srv_id / trans_id / insertion_time
 * 2. 폴링: srv_id:trans_id 키를 지수 백오프로 조회 (100ms 부터, 최대 2500ms, 30초 마감)
 * 3. 워커가 절대 시각으로 남긴 타이머를 경과 시간으로 변환하고 프로듀서 측 타이머 추가
 * <p>
 * 실패는 호출자에게 예외 대신 Optional.empty() 로 알린다
 * - 발행 실패, 마감 시간 초과, 저장된 결과 해석 불가
 */
@Slf4j
@Service
public class TransactionEnqueuer {

    private final MessageBus messageBus;
    private final CorrelationStore correlationStore;
    private final TransactionCodec codec;
    private final SlowCallSink slowCallSink;
    private final EnqueueProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final RetryTemplate lookupRetryTemplate;

    @Autowired
    public TransactionEnqueuer(
            MessageBus messageBus,
            CorrelationStore correlationStore,
            TransactionCodec codec,
            SlowCallSink slowCallSink,
            EnqueueProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this(messageBus, correlationStore, codec, slowCallSink, properties, clock, meterRegistry,
                new ThreadWaitSleeper());
    }

    public TransactionEnqueuer(
            MessageBus messageBus,
            CorrelationStore correlationStore,
            TransactionCodec codec,
            SlowCallSink slowCallSink,
            EnqueueProperties properties,
            Clock clock,
            MeterRegistry meterRegistry,
            Sleeper sleeper
    ) {
        this.messageBus = messageBus;
        this.correlationStore = correlationStore;
        this.codec = codec;
        this.slowCallSink = slowCallSink;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.lookupRetryTemplate = DeadlineRetry.template(
                properties.toRetrySettings(), clock, sleeper, List.of());
    }

    // trans_id 는 UUID, srv_id 는 설정값
    public Optional<ResultEnvelope> enqueueAndWait(QueryBatch batch) {
        return enqueueAndWait(UUID.randomUUID().toString(), batch, properties.serverId());
    }

    /**
     * @param transactionId 같은 srv_id 안에서 진행 중인 요청끼리 겹치지 않아야 한다
     * @return 결과, 실패 시 empty
     */
    public Optional<ResultEnvelope> enqueueAndWait(String transactionId, QueryBatch batch, String serverId) {
        TransactionEnvelope envelope = new TransactionEnvelope(serverId, transactionId, clock.instant(), batch);
        String correlationKey = envelope.correlationKey();
        double startedAt = now();

        // 1. 발행
        try {
            messageBus.publish(codec.encodeBatch(batch), envelope.attributes());
        } catch (Exception e) {
            log.error("[Enqueue] 발행 실패. key: {}, error: {}", correlationKey, e.getMessage(), e);
            count("publish_fail");
            return Optional.empty();
        }

        double publishSeconds = now() - startedAt;
        String publishMessage = format("%.03f - Bus Publish", publishSeconds);
        if (isSlow(publishSeconds)) {
            log.warn("[Enqueue] {}", publishMessage);
            slowCallSink.record(publishMessage);
        } else {
            log.debug("[Enqueue] {}", publishMessage);
        }

        // 2. 결과 폴링
        double ackCheckStartedAt = now();
        String stored;
        try {
            stored = lookupRetryTemplate.execute(
                    context -> correlationStore.get(correlationKey)
                            .orElseThrow(() -> new ResultNotReadyException(correlationKey)),
                    context -> {
                        throw new LookupTimeoutException(
                                correlationKey, context.getRetryCount(), context.getLastThrowable());
                    });
        } catch (LookupTimeoutException e) {
            log.warn("[Enqueue] 결과 조회 시간 초과. {}", e.getMessage());
            slowCallSink.record(e.getMessage());
            count("timeout");
            return Optional.empty();
        }

        // 3. 결과 해석 (재시도 안 함)
        ResultEnvelope result;
        try {
            result = codec.decodeResult(stored);
        } catch (TransactionSerializationException e) {
            log.error("[Enqueue] 저장된 결과 해석 불가. key: {}, value: {}", correlationKey, stored, e);
            count("unreadable");
            return Optional.empty();
        }

        double readAt = now();
        Map<String, Double> timers = result.getTimers();
        toElapsed(timers, RequestTimers.STORE_WRITE, readAt);
        toElapsed(timers, RequestTimers.TOTAL, readAt);
        timers.put(RequestTimers.ACK_CHECK, readAt - ackCheckStartedAt);

        double roundtrip = now() - startedAt;
        timers.put(RequestTimers.ROUNDTRIP, roundtrip);

        if (isSlow(roundtrip)) {
            // 워커 내부 구간(괄호)은 제외
            timers.forEach((name, seconds) -> {
                if (!RequestTimers.isInternal(name)) {
                    String line = format("%s - %.03f", RequestTimers.displayName(name), seconds);
                    log.warn("[Enqueue] {}", line);
                    slowCallSink.record(line);
                }
            });
        } else {
            log.debug("[Enqueue] {}", format("%.03f - SQL roundtrip", roundtrip));
        }

        count("success");
        return Optional.of(result);
    }

    // 워커가 기록한 시작 시각(epoch 초) -> 지금까지의 경과 시간
    private static void toElapsed(Map<String, Double> timers, String name, double now) {
        Double startedAt = timers.get(name);
        if (startedAt != null) {
            timers.put(name, now - startedAt);
        }
    }

    private boolean isSlow(double seconds) {
        return seconds * 1000 > properties.slowCallThreshold().toMillis();
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private void count(String result) {
        Counter.builder("enqueue_requests_total")
                .tag("result", result)
                .register(meterRegistry).increment();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
