package com.ureca.mimus.common.exception;

import com.ureca.mimus.common.BaseCode;
import lombok.Getter;

/**
 * 파이프라인 예외의 공통 부모
 * BaseCode 의 code 로 로그와 메트릭에서 예외 종류를 구분한다
 */
@Getter
public abstract class BaseCustomException extends RuntimeException {
    private final BaseCode baseCode;

    // 원인 같이 받음 (스택트레이스 유지)
    protected BaseCustomException(BaseCode baseCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.baseCode = baseCode;
    }

    public String getCode() {
        return baseCode.getCode();
    }
}
