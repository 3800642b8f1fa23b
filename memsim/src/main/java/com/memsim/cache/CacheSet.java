package com.memsim.cache;

/** Fixed array of lines, size = associativity. */
final class CacheSet {
    final CacheLine[] lines;

    CacheSet(int associativity) {
        lines = new CacheLine[associativity];
        for (int i = 0; i < associativity; i++)
            lines[i] = new CacheLine();
    }

    int associativity() {
        return lines.length;
    }

    /** Way holding a valid line with this tag, or -1. */
    int find(long tag) {
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].valid && lines[i].tag == tag)
                return i;
        }
        return -1;
    }

    /** First invalid way, or -1 when the set is full. */
    int firstInvalid() {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].valid)
                return i;
        }
        return -1;
    }

    /** Way with the smallest stamp for the policy; ties go to the lowest way. */
    int selectVictim(ReplacementPolicy policy) {
        int victim = 0;
        long min = Long.MAX_VALUE;
        for (int i = 0; i < lines.length; i++) {
            long stamp = policy == ReplacementPolicy.LRU ? lines[i].lastUsed : lines[i].insertOrder;
            if (stamp < min) {
                min = stamp;
                victim = i;
            }
        }
        return victim;
    }
}
