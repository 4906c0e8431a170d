package com.ureca.mimus.enqueue.exception;

import com.ureca.mimus.common.exception.InternalServerException;

import static com.ureca.mimus.common.BaseCode.LOOKUP_TIMEOUT;

/**
 * 마감 시간 안에 결과 저장소에서 결과를 찾지 못함
 */
public class LookupTimeoutException extends InternalServerException {

    public LookupTimeoutException(String correlationKey, int attempts, Throwable cause) {
        super(LOOKUP_TIMEOUT,
                LOOKUP_TIMEOUT.getMessage() + " key: " + correlationKey + ", attempts: " + attempts,
                cause);
    }
}
