package com.ureca.mimus.transaction.exception;

import com.ureca.mimus.common.exception.InternalServerException;

import static com.ureca.mimus.common.BaseCode.SERIALIZATION_FAILED;

public class TransactionSerializationException extends InternalServerException {

    public TransactionSerializationException(String message, Throwable cause) {
        super(SERIALIZATION_FAILED, message, cause);
    }
}
