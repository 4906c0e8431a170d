package com.ureca.mimus.worker.exception;

import com.ureca.mimus.common.exception.InternalServerException;

import static com.ureca.mimus.common.BaseCode.DATABASE_CONNECTION_FAILED;

/**
 * 기동 시 재시도 후에도 DB 에 연결하지 못함, 프로세스 기동 중단
 */
public class DatabaseConnectionException extends InternalServerException {

    public DatabaseConnectionException(Throwable cause) {
        super(DATABASE_CONNECTION_FAILED, DATABASE_CONNECTION_FAILED.getMessage(), cause);
    }
}
