package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.ErrorKind;

/**
 * Base exception for failures talking to Impala through the connection pool.
 */
public class ImpalaAccessException extends RuntimeException {

    private final ErrorKind kind;
    private final String database;

    public ImpalaAccessException(ErrorKind kind, String database, String message) {
        super(String.format("[%s:%s] %s", kind, database, message));
        this.kind = kind;
        this.database = database;
    }

    public ImpalaAccessException(ErrorKind kind, String database, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", kind, database, message), cause);
        this.kind = kind;
        this.database = database;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDatabase() {
        return database;
    }
}
