package com.ureca.mimus.bus;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.ureca.mimus.config.RabbitMQQueue;
import com.ureca.mimus.config.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ 기반 MessageBus
 * <p>
 * 발행: RabbitTemplate, 속성은 헤더로 전달
 * 수신: 전용 채널에서 basicGet (수동 ack), 대기 시간 동안 반복 조회
 * ack 하지 않은 메시지는 채널이 닫히면 브로커가 재전달
 * <p>
 * 채널은 스레드 안전하지 않으므로 pull/acknowledge 는 동기화
 */
@Slf4j
@Component
public class RabbitMessageBus implements MessageBus, DisposableBean {

    private static final long POLL_INTERVAL_MILLIS = 50;

    private final RabbitTemplate rabbitTemplate;
    private final ConnectionFactory connectionFactory;
    private final Duration waitWindow;
    private final Clock clock;
    private final Sleeper sleeper;

    private Connection connection;
    private Channel channel;

    @Autowired
    public RabbitMessageBus(
            RabbitTemplate rabbitTemplate,
            ConnectionFactory connectionFactory,
            WorkerProperties workerProperties,
            Clock clock
    ) {
        this(rabbitTemplate, connectionFactory, workerProperties, clock, new ThreadWaitSleeper());
    }

    public RabbitMessageBus(
            RabbitTemplate rabbitTemplate,
            ConnectionFactory connectionFactory,
            WorkerProperties workerProperties,
            Clock clock,
            Sleeper sleeper
    ) {
        this.rabbitTemplate = rabbitTemplate;
        this.connectionFactory = connectionFactory;
        this.waitWindow = workerProperties.pullWaitWindow();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public void publish(String body, Map<String, String> attributes) {
        Message message = MessageBuilder.withBody(body.getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding(StandardCharsets.UTF_8.name())
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .copyHeaders(new LinkedHashMap<String, Object>(attributes))
                .build();

        rabbitTemplate.send(RabbitMQQueue.QUERY_EXCHANGE, RabbitMQQueue.QUERY_ROUTING_KEY, message);

        log.debug("[Bus] 발행 완료. exchange: {}, routingKey: {}, attributes: {}",
                RabbitMQQueue.QUERY_EXCHANGE, RabbitMQQueue.QUERY_ROUTING_KEY, attributes);
    }

    @Override
    public synchronized List<PulledMessage> pull(int maxMessages) {
        List<PulledMessage> pulled = new ArrayList<>();
        long deadline = clock.millis() + waitWindow.toMillis();

        try {
            Channel ch = channel();
            while (pulled.size() < maxMessages) {
                GetResponse response = ch.basicGet(RabbitMQQueue.QUERY_QUEUE, false);
                if (response != null) {
                    pulled.add(toPulledMessage(response));
                    continue;
                }
                if (!pulled.isEmpty() || clock.millis() >= deadline) {
                    break;
                }
                sleeper.sleep(POLL_INTERVAL_MILLIS);
            }
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpException("메시지 대기 중 인터럽트", e);
        }

        return pulled;
    }

    @Override
    public synchronized void acknowledge(List<String> ackIds) {
        try {
            Channel ch = channel();
            for (String ackId : ackIds) {
                ch.basicAck(Long.parseLong(ackId), false);
            }
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public synchronized void destroy() {
        try {
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.warn("[Bus] 채널 종료 실패. error: {}", e.getMessage());
        } finally {
            channel = null;
            if (connection != null) {
                connection.close();
                connection = null;
            }
        }
    }

    // 닫혀 있으면 다시 연다 (이전 채널의 delivery tag 는 무효)
    private Channel channel() {
        if (channel == null || !channel.isOpen()) {
            if (connection == null || !connection.isOpen()) {
                connection = connectionFactory.createConnection();
            }
            channel = connection.createChannel(false);
            log.info("[Bus] 수신 채널 생성. queue: {}", RabbitMQQueue.QUERY_QUEUE);
        }
        return channel;
    }

    private static PulledMessage toPulledMessage(GetResponse response) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Map<String, Object> headers = response.getProps().getHeaders();
        if (headers != null) {
            // 헤더 값은 LongString 으로 올 수 있어서 문자열로 통일
            headers.forEach((name, value) -> {
                if (value != null) {
                    attributes.put(name, value.toString());
                }
            });
        }

        return new PulledMessage(
                String.valueOf(response.getEnvelope().getDeliveryTag()),
                new String(response.getBody(), StandardCharsets.UTF_8),
                attributes
        );
    }
}
