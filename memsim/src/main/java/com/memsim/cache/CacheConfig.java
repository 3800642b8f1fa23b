package com.memsim.cache;

import java.util.Objects;

import com.memsim.memory.InvalidConfigurationException;

/**
 * Validated cache geometry and policies.
 * numLines = cacheSize / blockSize, numSets = numLines / associativity
 * (integer division: lines left over by a non-dividing associativity are
 * unused).
 */
public final class CacheConfig {
    private final int cacheSizeBytes;
    private final int blockSizeBytes;
    private final int associativity;
    private final ReplacementPolicy replacementPolicy;
    private final WritePolicy writePolicy;
    private final AccessGranularity granularity;
    private final int numLines;
    private final int numSets;

    public CacheConfig(int cacheSizeBytes, int blockSizeBytes, int associativity, ReplacementPolicy replacementPolicy,
            WritePolicy writePolicy) {
        this(cacheSizeBytes, blockSizeBytes, associativity, replacementPolicy, writePolicy, AccessGranularity.BYTE);
    }

    public CacheConfig(int cacheSizeBytes, int blockSizeBytes, int associativity, ReplacementPolicy replacementPolicy,
            WritePolicy writePolicy, AccessGranularity granularity) {
        if (cacheSizeBytes <= 0 || blockSizeBytes <= 0)
            throw new InvalidConfigurationException(String.format(
                    "Cache and block size must be positive (cache=%d, block=%d)", cacheSizeBytes, blockSizeBytes));
        if (cacheSizeBytes % blockSizeBytes != 0)
            throw new InvalidConfigurationException(String.format(
                    "Cache size %d is not a multiple of block size %d", cacheSizeBytes, blockSizeBytes));
        int lines = cacheSizeBytes / blockSizeBytes;
        if (associativity <= 0 || associativity > lines)
            throw new InvalidConfigurationException(
                    String.format("Associativity %d outside [1, %d]", associativity, lines));
        this.cacheSizeBytes = cacheSizeBytes;
        this.blockSizeBytes = blockSizeBytes;
        this.associativity = associativity;
        this.replacementPolicy = Objects.requireNonNull(replacementPolicy, "replacementPolicy");
        this.writePolicy = Objects.requireNonNull(writePolicy, "writePolicy");
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        this.numLines = lines;
        this.numSets = lines / associativity;
    }

    /** Fully associative: one set holding every line. */
    public static CacheConfig fullyAssociative(int cacheSizeBytes, int blockSizeBytes,
            ReplacementPolicy replacementPolicy, WritePolicy writePolicy) {
        if (blockSizeBytes <= 0)
            throw new InvalidConfigurationException("Block size must be positive (got " + blockSizeBytes + ")");
        return new CacheConfig(cacheSizeBytes, blockSizeBytes, cacheSizeBytes / blockSizeBytes, replacementPolicy,
                writePolicy);
    }

    public int getCacheSizeBytes() {
        return cacheSizeBytes;
    }

    public int getBlockSizeBytes() {
        return blockSizeBytes;
    }

    public int getAssociativity() {
        return associativity;
    }

    public ReplacementPolicy getReplacementPolicy() {
        return replacementPolicy;
    }

    public WritePolicy getWritePolicy() {
        return writePolicy;
    }

    public AccessGranularity getGranularity() {
        return granularity;
    }

    public int getNumLines() {
        return numLines;
    }

    public int getNumSets() {
        return numSets;
    }

    @Override
    public String toString() {
        return String.format("Cache=%d bytes, Block=%d bytes, Lines=%d, Sets=%d, Assoc=%d, Repl=%s, Write=%s",
                cacheSizeBytes, blockSizeBytes, numLines, numSets, associativity, replacementPolicy, writePolicy);
    }
}
