package com.ureca.mimus.config;

/**
 * RabbitMQ 토폴로지 이름 중앙 관리
 * <p>
 * 네이밍 규칙:
 * - exchange: mimus.{domain}.exchange
 * - 큐: mimus.{domain}.{event}.queue
 */
public final class RabbitMQQueue {

    // DB 쿼리 배치
    public static final String QUERY_EXCHANGE = "mimus.db.exchange";
    public static final String QUERY_QUEUE = "mimus.db.queries.queue";
    public static final String QUERY_ROUTING_KEY = "db.queries";

    private RabbitMQQueue() {
        // 인스턴스화 방지
    }
}
