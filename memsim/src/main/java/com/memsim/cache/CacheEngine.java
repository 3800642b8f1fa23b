package com.memsim.cache;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import com.memsim.memory.AddressCodec;
import com.memsim.memory.CacheAddress;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Set-associative cache model (metadata only: tags, valid and dirty bits).
 *
 * An access is classified as hit or miss; misses fill an invalid way or evict
 * a victim chosen by LRU or FIFO. Under write-back a dirty victim is flushed to
 * the backing store exactly once; under write-through every write counts as one
 * backing-store write and no line ever becomes dirty. Counters only grow until
 * {@link #reset()}.
 *
 * One engine-wide lock guards lines, counters and the stamp clock. Write-backs
 * are issued while holding it, so lock order is always cache -> region table ->
 * controller.
 */
public class CacheEngine {
    private final CacheConfig config;
    private final CacheSet[] sets;
    private final BackingStore backingStore;
    private final List<CacheObserver> observers = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long clock = 0; // LRU / FIFO stamps
    private long reads;
    private long writes;
    private long hits;
    private long misses;
    private long memoryWrites;

    public CacheEngine(CacheConfig config) {
        this(config, BackingStore.NONE);
    }

    public CacheEngine(CacheConfig config, BackingStore backingStore) {
        this.config = Objects.requireNonNull(config, "config");
        this.backingStore = backingStore != null ? backingStore : BackingStore.NONE;
        this.sets = new CacheSet[config.getNumSets()];
        for (int i = 0; i < sets.length; i++)
            sets[i] = new CacheSet(config.getAssociativity());
        Log.debug(CACHE, "Cache created: %s", config);
    }

    public CacheConfig getConfig() {
        return config;
    }

    public void addObserver(CacheObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public void removeObserver(CacheObserver observer) {
        observers.remove(observer);
    }

    /**
     * One access to a single address. Never fails on its own; only the backing
     * store's write-back can raise.
     */
    public void access(long address, boolean isWrite) {
        CacheStats stats;
        lock.lock();
        try {
            accessLocked(address, isWrite);
            stats = statsLocked();
        } finally {
            lock.unlock();
        }
        publish(stats);
    }

    /**
     * Charge a multi-byte access according to the configured granularity: one
     * access per byte, or one per distinct block touched.
     */
    public void accessRange(long address, int length, boolean isWrite) {
        if (length <= 0)
            return;
        CacheStats stats;
        lock.lock();
        try {
            if (config.getGranularity() == AccessGranularity.BLOCK) {
                // block boundaries as the codec sees them (offset field width)
                long block = 1L << AddressCodec.bitsNeeded(config.getBlockSizeBytes());
                long first = address / block;
                long last = (address + length - 1) / block;
                for (long b = first; b <= last; b++)
                    accessLocked(b == first ? address : b * block, isWrite);
            } else {
                for (int i = 0; i < length; i++)
                    accessLocked(address + i, isWrite);
            }
            stats = statsLocked();
        } finally {
            lock.unlock();
        }
        publish(stats);
    }

    private void accessLocked(long address, boolean isWrite) {
        if (isWrite)
            writes++;
        else
            reads++;

        CacheAddress ca = AddressCodec.decodeCache(address, config.getBlockSizeBytes(), config.getNumSets());
        CacheSet set = sets[ca.getSetIndex()];

        int way = set.find(ca.getTag());
        if (way >= 0) {
            hits++;
            CacheLine line = set.lines[way];
            line.lastUsed = ++clock;
            if (isWrite) {
                if (config.getWritePolicy() == WritePolicy.WRITE_THROUGH)
                    memoryWrites++;
                else
                    line.dirty = true;
            }
            return;
        }

        misses++;
        way = set.firstInvalid();
        if (way < 0) {
            way = set.selectVictim(config.getReplacementPolicy());
            CacheLine victim = set.lines[way];
            if (victim.valid && victim.dirty && config.getWritePolicy() == WritePolicy.WRITE_BACK) {
                memoryWrites++;
                long blockAddress = AddressCodec.blockAddress(victim.tag, ca.getSetIndex(),
                        config.getBlockSizeBytes(), config.getNumSets());
                backingStore.writeBack(blockAddress, config.getBlockSizeBytes());
            }
        }
        fill(set.lines[way], ca.getTag(), isWrite);
    }

    private void fill(CacheLine line, long tag, boolean isWrite) {
        long stamp = ++clock;
        line.valid = true;
        line.tag = tag;
        line.lastUsed = stamp;
        line.insertOrder = stamp;
        line.dirty = isWrite && config.getWritePolicy() == WritePolicy.WRITE_BACK;
        if (isWrite && config.getWritePolicy() == WritePolicy.WRITE_THROUGH)
            memoryWrites++;
    }

    // --- counters / snapshots ---

    public CacheStats getStats() {
        lock.lock();
        try {
            return statsLocked();
        } finally {
            lock.unlock();
        }
    }

    private CacheStats statsLocked() {
        return new CacheStats(reads, writes, hits, misses, memoryWrites, config);
    }

    /** Independent copy of every set: [set][way] -> (valid, tag, dirty). */
    public LineSnapshot[][] getSetsSnapshot() {
        lock.lock();
        try {
            LineSnapshot[][] out = new LineSnapshot[sets.length][];
            for (int s = 0; s < sets.length; s++) {
                CacheLine[] lines = sets[s].lines;
                out[s] = new LineSnapshot[lines.length];
                for (int w = 0; w < lines.length; w++)
                    out[s][w] = lines[w].snapshot();
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** True if the block holding address is resident (no counters touched). */
    public boolean contains(long address) {
        CacheAddress ca = AddressCodec.decodeCache(address, config.getBlockSizeBytes(), config.getNumSets());
        lock.lock();
        try {
            return sets[ca.getSetIndex()].find(ca.getTag()) >= 0;
        } finally {
            lock.unlock();
        }
    }

    public String getTopologyInfo() {
        return config.toString();
    }

    /** Invalidate every line and zero the counters. Dirty lines are dropped, not flushed. */
    public void reset() {
        CacheStats stats;
        lock.lock();
        try {
            for (CacheSet set : sets) {
                for (CacheLine line : set.lines)
                    line.invalidate();
            }
            clock = 0;
            reads = writes = hits = misses = memoryWrites = 0;
            stats = statsLocked();
        } finally {
            lock.unlock();
        }
        publish(stats);
    }

    private void publish(CacheStats stats) {
        for (CacheObserver o : observers) {
            try {
                o.onStatsUpdated(stats);
            } catch (RuntimeException ex) {
                Log.warn(CACHE, "Observer %s failed: %s", o.getClass().getSimpleName(), ex.toString());
            }
        }
    }
}
