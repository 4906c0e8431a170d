package com.ureca.mimus.transaction.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 버스로 발행되는 트랜잭션 하나
 * 본문은 batch, 나머지는 메시지 속성(헤더)으로 전달
 */
public record TransactionEnvelope(
        String serverId,
        String transactionId,
        Instant insertedAt,
        QueryBatch batch
) {
    public static final String ATTR_SERVER_ID = "srv_id";
    public static final String ATTR_TRANSACTION_ID = "trans_id";
    public static final String ATTR_INSERTION_TIME = "insertion_time";

    public TransactionEnvelope {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(insertedAt, "insertedAt");
        Objects.requireNonNull(batch, "batch");
    }

    // 결과 저장소 키, 진행 중인 요청 사이에서 유일
    public String correlationKey() {
        return correlationKey(serverId, transactionId);
    }

    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_SERVER_ID, serverId);
        attributes.put(ATTR_TRANSACTION_ID, transactionId);
        attributes.put(ATTR_INSERTION_TIME, formatEpochSeconds(insertedAt));
        return attributes;
    }

    public static String correlationKey(String serverId, String transactionId) {
        return serverId + ":" + transactionId;
    }

    // epoch 초 문자열 (소수점 이하 밀리초)
    public static String formatEpochSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli()).movePointLeft(3).toPlainString();
    }

    public static double parseEpochSeconds(String value) {
        return new BigDecimal(value.trim()).doubleValue();
    }
}
