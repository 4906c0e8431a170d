package com.ureca.mimus.common.exception;

import com.ureca.mimus.common.BaseCode;

/**
 * 호출자의 입력 문제가 아닌 파이프라인 내부에서 발생하는 복구 불가능한 예외
 */
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}
