package com.ureca.mimus.worker;

import com.ureca.mimus.bus.MessageBus;
import com.ureca.mimus.bus.PulledMessage;
import com.ureca.mimus.common.exception.BaseCustomException;
import com.ureca.mimus.common.telemetry.RequestTimers;
import com.ureca.mimus.config.RabbitMQQueue;
import com.ureca.mimus.config.WorkerProperties;
import com.ureca.mimus.store.CorrelationStore;
import com.ureca.mimus.transaction.TransactionCodec;
import com.ureca.mimus.transaction.dto.QueryBatch;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import com.ureca.mimus.transaction.dto.TransactionEnvelope;
import com.ureca.mimus.transaction.exception.MalformedBatchException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 버스에서 쿼리 배치를 하나씩 꺼내 실행하고 결과를 저장소에 올리는 워커
 * <p>
 * 메시지 하나의 처리 순서
 * 1. pull (대기 시간 안에 없으면 idle)
 * 2. 속성/본문 해석, 큐 대기 시간이 message-timeout 을 넘으면 실행 없이 ack 후 폐기
 * 3. BatchExecutor 로 한 트랜잭션 실행 + 커밋
 * 4. ack
 * 5. 결과를 srv_id:trans_id 키로 TTL 과 함께 저장
 * <p>
 * 처리 중 예외는 메시지 단위로 격리: 로그 남기고 ack 해서 구독에서 제거, 루프는 계속
 * 결과를 못 받은 프로듀서는 마감 시간 초과로 끝난다
 */
@Slf4j
@Component
public class QueueWorker {

    private final MessageBus messageBus;
    private final CorrelationStore correlationStore;
    private final TransactionCodec codec;
    private final BatchExecutor batchExecutor;
    private final WorkerProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Sleeper sleeper;

    // 종료 요청 플래그
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    // "메시지 없음" 경고용 (마지막 메시지 이후 경과 기준)
    private double idleSince;
    private double previousWarn;

    @Autowired
    public QueueWorker(
            MessageBus messageBus,
            CorrelationStore correlationStore,
            TransactionCodec codec,
            BatchExecutor batchExecutor,
            WorkerProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this(messageBus, correlationStore, codec, batchExecutor, properties, clock, meterRegistry,
                new ThreadWaitSleeper());
    }

    public QueueWorker(
            MessageBus messageBus,
            CorrelationStore correlationStore,
            TransactionCodec codec,
            BatchExecutor batchExecutor,
            WorkerProperties properties,
            Clock clock,
            MeterRegistry meterRegistry,
            Sleeper sleeper
    ) {
        this.messageBus = messageBus;
        this.correlationStore = correlationStore;
        this.codec = codec;
        this.batchExecutor = batchExecutor;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
        this.idleSince = now();
    }

    // 종료 요청 전까지 메시지를 하나씩 처리
    public void run() {
        log.info("[Worker] 메시지 폴링 시작. queue: {}", RabbitMQQueue.QUERY_QUEUE);
        idleSince = now();
        previousWarn = 0;

        while (!shutdownRequested.get() && !Thread.currentThread().isInterrupted()) {
            runOnce();
        }

        log.info("[Worker] 메시지 폴링 종료. queue: {}", RabbitMQQueue.QUERY_QUEUE);
    }

    @PreDestroy
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[Worker] 종료 요청. 처리 중인 메시지 완료 후 중단됩니다.");
        }
    }

    /**
     * pull 한 번과 그 메시지 처리
     *
     * @return 메시지를 받았으면 true (처리 성공 여부와 무관), 없었으면 false
     */
    public boolean runOnce() {
        RequestTimers timers = new RequestTimers(clock);
        timers.start(RequestTimers.TOTAL);
        timers.start(RequestTimers.WORKER_PROCESSING);
        timers.start(RequestTimers.PULL_WAIT);

        List<PulledMessage> pulled;
        try {
            pulled = messageBus.pull(1);
        } catch (Exception e) {
            log.error("[Worker] pull 실패. error: {}", e.getMessage(), e);
            pulled = List.of();
        }
        timers.stop(RequestTimers.PULL_WAIT);

        if (pulled.isEmpty()) {
            idle();
            return false;
        }

        process(pulled.get(0), timers);

        idleSince = now();
        previousWarn = 0;
        return true;
    }

    private void process(PulledMessage message, RequestTimers timers) {
        String uniqId = TransactionEnvelope.correlationKey(
                message.attribute(TransactionEnvelope.ATTR_SERVER_ID),
                message.attribute(TransactionEnvelope.ATTR_TRANSACTION_ID));
        boolean acknowledged = false;
        String result = "dropped";

        try {
            timers.start(RequestTimers.JSON_LOAD);

            if (message.attribute(TransactionEnvelope.ATTR_SERVER_ID) == null
                    || message.attribute(TransactionEnvelope.ATTR_TRANSACTION_ID) == null) {
                throw new MalformedBatchException("srv_id / trans_id 속성 누락. attributes: " + message.attributes(), null);
            }

            // 900 TOTAL 은 프로듀서가 발행한 시각부터 잰다
            String insertionTime = message.attribute(TransactionEnvelope.ATTR_INSERTION_TIME);
            if (insertionTime != null) {
                double insertedAt = TransactionEnvelope.parseEpochSeconds(insertionTime);
                double queueWait = timers.now() - insertedAt;
                timers.put(RequestTimers.TOTAL, insertedAt, true);
                timers.put(RequestTimers.QUEUE_WAIT, queueWait);

                if (queueWait * 1000 > properties.messageTimeout().toMillis()) {
                    // 프로듀서는 이미 포기한 요청
                    log.error("[Worker] 오래된 메시지 폐기. uniqId: {}, {}초 경과",
                            uniqId, format("%.03f", queueWait));
                    messageBus.acknowledge(List.of(message.ackId()));
                    acknowledged = true;
                    result = "stale";
                    return;
                }
            }

            log.debug("[Worker] 메시지 본문. uniqId: {}, body: {}", uniqId, message.body());
            QueryBatch batch = codec.decodeBatch(message.body());
            timers.stop(RequestTimers.JSON_LOAD);

            BatchExecutionResult executed = batchExecutor.execute(batch, uniqId, timers);
            if (executed.failedStatements() > 0) {
                Counter.builder("worker_statements_failed_total")
                        .register(meterRegistry).increment(executed.failedStatements());
            }

            timers.start(RequestTimers.ACK);
            messageBus.acknowledge(List.of(message.ackId()));
            acknowledged = true;
            timers.stop(RequestTimers.ACK);

            // 802, 900 은 진행 중(절대 시각)인 채로 실어 보내고 프로듀서가 경과 시간으로 바꾼다
            timers.start(RequestTimers.STORE_WRITE);
            ResultEnvelope envelope = ResultEnvelope.of(
                    executed.results(), executed.affected(), timers.publishableSnapshot());
            correlationStore.setWithTtl(uniqId, codec.encodeResult(envelope), properties.resultTtl());
            timers.stop(RequestTimers.STORE_WRITE);

            timers.stop(RequestTimers.TOTAL);
            timers.stop(RequestTimers.WORKER_PROCESSING);

            logTimers(timers);
            result = "success";

        } catch (Exception e) {
            log.error("[Worker] 메시지 처리 불가. 구독에서 제거하고 계속 진행. uniqId: {}, code: {}, body: {}",
                    uniqId, errorCode(e), message.body(), e);
            if (!acknowledged) {
                acknowledgeAfterFailure(message, uniqId);
            }

        } finally {
            Counter.builder("worker_messages_processed_total")
                    .tag("result", result)
                    .register(meterRegistry).increment();
        }
    }

    private void acknowledgeAfterFailure(PulledMessage message, String uniqId) {
        if (message.ackId() == null) {
            return;
        }
        try {
            messageBus.acknowledge(List.of(message.ackId()));
        } catch (Exception e) {
            // ack 실패 시 버스가 재전달
            log.error("[Worker] ack 실패. 재전달 예정. uniqId: {}, error: {}", uniqId, e.getMessage());
        }
    }

    private static String errorCode(Exception e) {
        return e instanceof BaseCustomException custom ? custom.getCode() : e.getClass().getSimpleName();
    }

    // 이름 순 (= 처리 순서) 으로 출력, 기준 초과는 WARN
    private void logTimers(RequestTimers timers) {
        double warnThreshold = properties.timerWarnThreshold().toMillis() / 1000.0;

        timers.snapshot().forEach((name, seconds) -> {
            String line = format("%06.3f - %s", seconds, RequestTimers.displayName(name));
            if (seconds > warnThreshold) {
                log.warn("[Worker] {}", line);
            } else {
                log.info("[Worker] {}", line);
            }
        });
    }

    private void idle() {
        double soFar = now() - idleSince;
        double warnInterval = properties.noMessageWarnInterval().toMillis() / 1000.0;

        if (soFar - previousWarn > warnInterval) {
            previousWarn = soFar;
            log.warn("[Worker] 메시지 없음. queue: {}, {}초 동안 수신 없음",
                    RabbitMQQueue.QUERY_QUEUE, format("%.03f", soFar));
        }

        try {
            sleeper.sleep(properties.idleSleep().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Worker] 대기 중 인터럽트. 루프 종료");
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
