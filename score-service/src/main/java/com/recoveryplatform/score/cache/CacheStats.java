package com.recoveryplatform.score.cache;

/**
 * Point-in-time diagnostics of the score cache. Observational only.
 */
public record CacheStats(
    int size,
    int capacity,
    int pendingWrites,
    long hits,
    long misses,
    long durableHits,
    long evictions,
    long durableWrites,
    long durableWriteFailures
) {}
