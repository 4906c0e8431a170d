package com.ureca.mimus.worker.exception;

import com.ureca.mimus.common.exception.InternalServerException;

import static com.ureca.mimus.common.BaseCode.BATCH_ROLLED_BACK;

public class BatchRollbackException extends InternalServerException {

    public BatchRollbackException(String uniqId, String statement, Throwable cause) {
        super(BATCH_ROLLED_BACK,
                BATCH_ROLLED_BACK.getMessage() + " uniqId: " + uniqId + ", statement: " + statement,
                cause);
    }
}
