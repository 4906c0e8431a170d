package com.ureca.mimus.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 쿼리 배치 토폴로지
 * <p>
 * Direct exchange 하나에 durable 큐 하나
 * 워커 여러 대가 같은 큐를 나눠 소비 (competing consumers)
 */
@Configuration
public class RabbitMQConfig {

    @Bean
    public DirectExchange queryExchange() {
        return new DirectExchange(RabbitMQQueue.QUERY_EXCHANGE, true, false);
    }

    @Bean
    public Queue queryQueue() {
        return new Queue(RabbitMQQueue.QUERY_QUEUE, true);
    }

    @Bean
    public Binding queryBinding(DirectExchange queryExchange, Queue queryQueue) {
        return BindingBuilder
                .bind(queryQueue)
                .to(queryExchange)
                .with(RabbitMQQueue.QUERY_ROUTING_KEY);
    }
}
