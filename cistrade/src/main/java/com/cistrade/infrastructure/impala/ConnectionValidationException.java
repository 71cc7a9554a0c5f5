package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.ErrorKind;

/**
 * Exception thrown when a pooled connection fails its liveness check.
 */
public class ConnectionValidationException extends ImpalaAccessException {

    public ConnectionValidationException(String database, String message, Throwable cause) {
        super(ErrorKind.CONNECTION_VALIDATION_FAILURE, database, message, cause);
    }
}
