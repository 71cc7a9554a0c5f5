package com.cistrade.infrastructure.impala;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens raw sessions against the analytic database. Called by the pool outside its lock.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Open a new session bound to {@code database}.
     *
     * @throws SQLException if the driver cannot connect
     */
    Connection create(String database) throws SQLException;
}
