package com.ureca.mimus.enqueue.exception;

// 아직 결과 없음, 재시도 대상
public class ResultNotReadyException extends RuntimeException {

    public ResultNotReadyException(String correlationKey) {
        super("결과 미도착. key: " + correlationKey);
    }
}
