package com.cistrade.infrastructure.impala;

/**
 * Point-in-time statistics for an {@link ImpalaConnectionPool}.
 *
 * @param maxConnections  configured cap
 * @param outstanding     live connections (idle + checked out)
 * @param idle            connections sitting in the free lists
 * @param checkedOut      connections currently owned by callers
 * @param waiting         threads blocked in acquire
 * @param totalCreated    cumulative connections opened
 * @param totalDestroyed  cumulative connections closed by the pool
 * @param totalAcquired   cumulative successful acquires
 * @param totalExhausted  cumulative acquires that timed out
 */
public record PoolStats(
    int maxConnections,
    int outstanding,
    int idle,
    int checkedOut,
    int waiting,
    long totalCreated,
    long totalDestroyed,
    long totalAcquired,
    long totalExhausted
) {
}
