package com.ureca.mimus.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.mimus.transaction.dto.QueryBatch;
import com.ureca.mimus.transaction.dto.ResultEnvelope;
import com.ureca.mimus.transaction.exception.MalformedBatchException;
import com.ureca.mimus.transaction.exception.TransactionSerializationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 버스 메시지 본문 / 결과 저장소 값의 JSON 변환
 */
@Component
@RequiredArgsConstructor
public class TransactionCodec {

    private final ObjectMapper objectMapper;

    public String encodeBatch(QueryBatch batch) {
        try {
            return objectMapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new TransactionSerializationException("쿼리 배치 직렬화 실패", e);
        }
    }

    /**
     * @throws MalformedBatchException JSON 파싱 실패, queries 누락, 항목 형식 오류
     */
    public QueryBatch decodeBatch(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedBatchException("빈 메시지 본문", null);
        }
        try {
            return objectMapper.readValue(body, QueryBatch.class);
        } catch (JsonProcessingException e) {
            throw new MalformedBatchException("쿼리 배치 파싱 불가: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeResult(ResultEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TransactionSerializationException("결과 직렬화 실패", e);
        }
    }

    public ResultEnvelope decodeResult(String value) {
        try {
            return objectMapper.readValue(value, ResultEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new TransactionSerializationException("결과 파싱 불가: " + e.getOriginalMessage(), e);
        }
    }
}
