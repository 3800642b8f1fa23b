package com.memsim.cache;

/**
 * One way of a set. Owned by its set, mutated only by the cache engine under
 * its lock.
 */
final class CacheLine {
    boolean valid;
    long tag;
    boolean dirty;
    long lastUsed; // LRU stamp
    long insertOrder; // FIFO stamp

    void invalidate() {
        valid = false;
        tag = 0;
        dirty = false;
        lastUsed = 0;
        insertOrder = 0;
    }

    LineSnapshot snapshot() {
        return new LineSnapshot(valid, tag, dirty);
    }
}
