package com.memsim.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.memsim.memory.InvalidConfigurationException;

/**
 * Hit/miss classification, replacement and write policies. Unless noted the
 * cache is 1 KiB with 16-byte blocks; 2-way gives 32 sets, so addresses 0x200
 * apart share a set.
 */
public class CacheEngineTest {

    private static final long A = 0x000, B = 0x200, C = 0x400, D = 0x600;

    private final List<String> flushes = new ArrayList<>();
    private final BackingStore recorder = (blockAddress, blockSize) -> {
        flushes.add(String.format("0x%X/%d", blockAddress, blockSize));
        return 0;
    };

    @BeforeEach
    public void setUp() {
        flushes.clear();
    }

    private CacheEngine cache(int assoc, ReplacementPolicy repl, WritePolicy write) {
        return new CacheEngine(new CacheConfig(1024, 16, assoc, repl, write), recorder);
    }

    @Test
    public void directMappedSingleAddress() {
        CacheEngine c = cache(1, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        for (int i = 0; i < 5; i++)
            c.access(0x40, false);
        assertEquals(1, c.getStats().getMisses());
        assertEquals(4, c.getStats().getHits());
        // 64 sets: 0x440 lands on the same line with another tag
        c.access(0x440, false);
        c.access(0x40, false);
        assertEquals(3, c.getStats().getMisses());
        assertEquals(4, c.getStats().getHits());
    }

    @Test
    public void lruEvictsLeastRecentlyUsed() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, false);
        c.access(B, false);
        c.access(C, false);
        assertFalse(c.contains(A), "A was least recently used");
        assertTrue(c.contains(B));
        assertTrue(c.contains(C));
        c.access(B, false);
        c.access(C, false);
        c.access(A, false);
        CacheStats s = c.getStats();
        assertEquals(2, s.getHits());
        assertEquals(4, s.getMisses());
    }

    @Test
    public void lruHitProtectsLine() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, false);
        c.access(B, false);
        c.access(A, false); // hit refreshes A
        c.access(C, false);
        assertTrue(c.contains(A));
        assertFalse(c.contains(B));
    }

    @Test
    public void fifoIgnoresHits() {
        CacheEngine c = cache(2, ReplacementPolicy.FIFO, WritePolicy.WRITE_BACK);
        c.access(A, false);
        c.access(B, false);
        c.access(A, false); // hit does not protect A
        c.access(C, false);
        assertFalse(c.contains(A), "oldest insertion is evicted regardless of hits");
        assertTrue(c.contains(B));
        c.access(D, false);
        assertFalse(c.contains(B));
        assertTrue(c.contains(C));
    }

    @Test
    public void writeBackFlushesDirtyVictimOnce() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A + 4, true); // dirty
        c.access(B, false);
        c.access(C, false); // evicts A
        assertEquals(List.of("0x0/16"), flushes);
        assertEquals(1, c.getStats().getMemoryWrites());
        c.access(D, false); // evicts clean B
        assertEquals(1, flushes.size(), "clean eviction produces no write");
        assertEquals(1, c.getStats().getMemoryWrites());
    }

    @Test
    public void writeHitMarksDirtyWithoutWriting() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, false);
        c.access(A, true);
        assertEquals(0, c.getStats().getMemoryWrites());
        LineSnapshot line = c.getSetsSnapshot()[0][0];
        assertTrue(line.isValid());
        assertTrue(line.isDirty());
    }

    @Test
    public void writeThroughCountsEveryWrite() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_THROUGH);
        c.access(A, true); // miss
        c.access(A, true); // hit
        c.access(A, false);
        c.access(B, true);
        c.access(C, true); // evicts A, never dirty
        assertEquals(4, c.getStats().getMemoryWrites());
        assertTrue(flushes.isEmpty());
        for (LineSnapshot[] set : c.getSetsSnapshot())
            for (LineSnapshot l : set)
                assertFalse(l.isDirty());
    }

    @Test
    public void scenarioDistinctSets() {
        // 0x00, 0x10, 0x20 fall in sets 0, 1 and 2
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(0x0000, false);
        c.access(0x0010, false);
        c.access(0x0020, false);
        c.access(0x0000, true);
        CacheStats s = c.getStats();
        assertEquals(1, s.getHits());
        assertEquals(3, s.getMisses());
        assertEquals(3, s.getReads());
        assertEquals(1, s.getWrites());
        assertEquals(0, s.getMemoryWrites());
        assertEquals("0x0*", c.getSetsSnapshot()[0][0].toString());
    }

    @Test
    public void scenarioSameSet() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, false);
        c.access(B, false);
        c.access(C, false); // evicts clean A
        c.access(A, true); // evicts clean B
        CacheStats s = c.getStats();
        assertEquals(0, s.getHits());
        assertEquals(4, s.getMisses());
        assertEquals(0, s.getMemoryWrites());
        assertTrue(flushes.isEmpty());
        assertTrue(c.contains(A));
        assertTrue(c.contains(C));
        assertFalse(c.contains(B));
    }

    @Test
    public void fullyAssociativeWriteBackAddress() {
        CacheEngine c = new CacheEngine(
                CacheConfig.fullyAssociative(64, 16, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK), recorder);
        assertEquals(1, c.getConfig().getNumSets());
        c.access(0x100, true);
        c.access(0x200, false);
        c.access(0x300, false);
        c.access(0x400, false);
        c.access(0x500, false); // evicts 0x100
        assertEquals(List.of("0x100/16"), flushes);
    }

    @Test
    public void nonPowerOfTwoSetsRecoverBlockAddress() {
        // 768 / 16 = 48 lines, 2-way -> 24 sets; 0x190 folds onto set 1
        CacheEngine c = new CacheEngine(
                new CacheConfig(768, 16, 2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK), recorder);
        assertEquals(24, c.getConfig().getNumSets());
        c.access(0x190, true);
        c.access(0x010, false);
        c.access(0x210, false); // third tag in set 1
        assertEquals(List.of("0x190/16"), flushes);
    }

    @Test
    public void granularity() {
        CacheEngine perByte = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        perByte.accessRange(0, 32, false);
        assertEquals(32, perByte.getStats().getReads());
        assertEquals(2, perByte.getStats().getMisses());

        CacheEngine perBlock = new CacheEngine(new CacheConfig(1024, 16, 2, ReplacementPolicy.LRU,
                WritePolicy.WRITE_BACK, AccessGranularity.BLOCK), recorder);
        perBlock.accessRange(8, 16, false); // touches blocks 0 and 1
        assertEquals(2, perBlock.getStats().getReads());
        assertEquals(2, perBlock.getStats().getMisses());
        perBlock.accessRange(0, 0, true);
        assertEquals(0, perBlock.getStats().getWrites());
    }

    @Test
    public void blockGranularityFollowsDecodedBlocksForOddBlockSizes() {
        // 12-byte blocks decode with a 4-bit offset, so blocks start every 16 bytes
        CacheEngine c = new CacheEngine(new CacheConfig(96, 12, 1, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK,
                AccessGranularity.BLOCK), recorder);
        c.accessRange(0, 24, false);
        assertEquals(2, c.getStats().getReads());
        assertEquals(2, c.getStats().getMisses());
        assertEquals(0, c.getStats().getHits());
        assertTrue(c.contains(0));
        assertTrue(c.contains(20));

        c.accessRange(4, 8, false); // inside the first decoded block
        assertEquals(1, c.getStats().getHits());
    }

    @Test
    public void snapshotIsIndependentCopy() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, false);
        LineSnapshot[][] snap = c.getSetsSnapshot();
        assertEquals(32, snap.length);
        assertEquals(2, snap[0].length);
        c.access(A, true);
        c.access(B, false);
        assertFalse(snap[0][0].isDirty(), "old snapshot unaffected by later accesses");
        assertFalse(snap[0][1].isValid());
        snap[0][0] = null;
        assertNotNull(c.getSetsSnapshot()[0][0]);
    }

    @Test
    public void observersGetStatsAndFailuresAreContained() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        List<Long> seen = new ArrayList<>();
        c.addObserver(s -> {
            throw new IllegalStateException("broken sink");
        });
        c.addObserver(s -> seen.add(s.getAccesses()));
        c.access(A, false);
        c.access(A, false);
        assertEquals(List.of(1L, 2L), seen);
    }

    @Test
    public void statsRates() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        assertEquals(0.0, c.getStats().getHitRate());
        c.access(A, false);
        c.access(A, false);
        c.access(A, false);
        c.access(B, false);
        assertEquals(0.5, c.getStats().getHitRate(), 1e-9);
        assertEquals(0.5, c.getStats().getMissRate(), 1e-9);
    }

    @Test
    public void resetClearsLinesAndCounters() {
        CacheEngine c = cache(2, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK);
        c.access(A, true);
        c.reset();
        assertEquals(0, c.getStats().getAccesses());
        assertFalse(c.contains(A));
        assertTrue(flushes.isEmpty(), "reset drops dirty lines without flushing");
    }

    @Test
    public void invalidConfigurations() {
        assertThrows(InvalidConfigurationException.class,
                () -> new CacheConfig(1000, 16, 1, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK));
        assertThrows(InvalidConfigurationException.class,
                () -> new CacheConfig(1024, 0, 1, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK));
        assertThrows(InvalidConfigurationException.class,
                () -> new CacheConfig(0, 16, 1, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK));
        assertThrows(InvalidConfigurationException.class,
                () -> new CacheConfig(1024, 16, 0, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK));
        assertThrows(InvalidConfigurationException.class,
                () -> new CacheConfig(1024, 16, 65, ReplacementPolicy.LRU, WritePolicy.WRITE_BACK));
        assertThrows(InvalidConfigurationException.class, () -> ReplacementPolicy.parse("MRU"));
        assertThrows(InvalidConfigurationException.class, () -> WritePolicy.parse("sometimes"));
        assertEquals(WritePolicy.WRITE_THROUGH, WritePolicy.parse("write-through"));
        assertEquals(WritePolicy.WRITE_BACK, WritePolicy.parse("wb"));
    }
}
