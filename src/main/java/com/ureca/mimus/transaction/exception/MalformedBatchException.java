package com.ureca.mimus.transaction.exception;

import com.ureca.mimus.common.exception.InternalServerException;

import static com.ureca.mimus.common.BaseCode.MALFORMED_BATCH;

/**
 * 메시지 본문을 쿼리 배치로 해석할 수 없음
 * 재전달해도 결과가 같으므로 워커는 ack 후 버린다
 */
public class MalformedBatchException extends InternalServerException {

    public MalformedBatchException(String message, Throwable cause) {
        super(MALFORMED_BATCH, message, cause);
    }
}
