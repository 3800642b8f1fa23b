package com.memsim.cache;

/** Receives the aggregate counters after every cache access. */
@FunctionalInterface
public interface CacheObserver {
    void onStatsUpdated(CacheStats stats);
}
