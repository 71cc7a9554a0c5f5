package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.ErrorKind;

/**
 * Exception thrown when a statement fails on a live connection.
 */
public class QueryExecutionException extends ImpalaAccessException {

    public QueryExecutionException(String database, String message, Throwable cause) {
        super(ErrorKind.QUERY_EXECUTION_FAILURE, database, message, cause);
    }
}
