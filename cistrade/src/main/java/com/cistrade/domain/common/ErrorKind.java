package com.cistrade.domain.common;

/**
 * Failure categories for database access and audit delivery.
 */
public enum ErrorKind {
    CONNECTION_CREATE_FAILURE,
    CONNECTION_VALIDATION_FAILURE,
    POOL_EXHAUSTED,
    QUERY_EXECUTION_FAILURE,
    QUEUE_FULL
}
