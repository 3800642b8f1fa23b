package com.memsim.cache;

/**
 * Where a cache flushes dirty blocks. The cache holds metadata only; a
 * write-back is accounted as one additional write of the whole block.
 */
public interface BackingStore {

    /** A backing store that absorbs write-backs (stand-alone cache use). */
    BackingStore NONE = (blockAddress, blockSize) -> 0;

    /**
     * Flush the block starting at blockAddress.
     *
     * @return cycle cost reported by the store
     */
    int writeBack(long blockAddress, int blockSize);
}
