package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.ErrorKind;

/**
 * Exception thrown when the driver cannot open a new session.
 */
public class ConnectionCreateException extends ImpalaAccessException {

    public ConnectionCreateException(String database, String message, Throwable cause) {
        super(ErrorKind.CONNECTION_CREATE_FAILURE, database, message, cause);
    }
}
