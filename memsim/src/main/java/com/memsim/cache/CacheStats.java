package com.memsim.cache;

/**
 * Immutable counters of a cache plus the geometry they were measured on.
 */
public final class CacheStats {
    private final long reads;
    private final long writes;
    private final long hits;
    private final long misses;
    private final long memoryWrites;
    private final CacheConfig config;

    public CacheStats(long reads, long writes, long hits, long misses, long memoryWrites, CacheConfig config) {
        this.reads = reads;
        this.writes = writes;
        this.hits = hits;
        this.misses = misses;
        this.memoryWrites = memoryWrites;
        this.config = config;
    }

    public long getReads() {
        return reads;
    }

    public long getWrites() {
        return writes;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /** Writes sent to the backing store: write-through writes plus write-back flushes. */
    public long getMemoryWrites() {
        return memoryWrites;
    }

    public long getAccesses() {
        return reads + writes;
    }

    public double getHitRate() {
        long total = getAccesses();
        return total > 0 ? (double) hits / total : 0.0;
    }

    public double getMissRate() {
        long total = getAccesses();
        return total > 0 ? (double) misses / total : 0.0;
    }

    public CacheConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return String.format("reads=%d writes=%d hits=%d misses=%d memWrites=%d hitRate=%.2f%% missRate=%.2f%%",
                reads, writes, hits, misses, memoryWrites, getHitRate() * 100, getMissRate() * 100);
    }
}
