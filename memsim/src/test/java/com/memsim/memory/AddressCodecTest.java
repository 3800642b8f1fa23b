package com.memsim.memory;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * DRAM and cache address decomposition: field order, round trips, and the
 * non-power-of-two / single-set corner cases.
 */
public class AddressCodecTest {

    private final DramGeometry geometry = new DramGeometry(2, 2, 4, 8, 16);

    @Test
    public void dramRoundTripOverWholeGeometry() {
        for (int ch = 0; ch < 2; ch++)
            for (int rk = 0; rk < 2; rk++)
                for (int bk = 0; bk < 4; bk++)
                    for (int row = 0; row < 8; row++)
                        for (int col = 0; col < 16; col++) {
                            DramAddress d = new DramAddress(ch, rk, bk, row, col);
                            long addr = AddressCodec.encodeDram(d, geometry);
                            assertEquals(d, AddressCodec.decodeDram(addr, geometry), "addr=" + addr);
                        }
    }

    @Test
    public void columnIsFastestVaryingField() {
        assertEquals(new DramAddress(0, 0, 0, 0, 1), AddressCodec.decodeDram(1, geometry));
        assertEquals(new DramAddress(0, 0, 0, 1, 0), AddressCodec.decodeDram(16, geometry));
        assertEquals(new DramAddress(0, 0, 1, 0, 0), AddressCodec.decodeDram(16 * 8, geometry));
        assertEquals(new DramAddress(0, 1, 0, 0, 0), AddressCodec.decodeDram(16 * 8 * 4, geometry));
        assertEquals(new DramAddress(1, 0, 0, 0, 0), AddressCodec.decodeDram(16 * 8 * 4 * 2, geometry));
    }

    @Test
    public void decodeOutsidePhysicalSpaceFails() {
        assertEquals(1024, geometry.getPhysicalSize());
        assertThrows(OutOfBoundsException.class, () -> AddressCodec.decodeDram(1024, geometry));
        assertThrows(OutOfBoundsException.class, () -> AddressCodec.decodeDram(-1, geometry));
        assertThrows(OutOfBoundsException.class,
                () -> AddressCodec.encodeDram(new DramAddress(0, 0, 4, 0, 0), geometry));
    }

    @Test
    public void cacheFieldsForPowerOfTwoGeometry() {
        // 16-byte blocks, 32 sets: 4 offset bits, 5 set bits
        CacheAddress ca = AddressCodec.decodeCache(0x1234, 16, 32);
        assertEquals(0x4, ca.getOffset());
        assertEquals(0x123 & 31, ca.getSetIndex());
        assertEquals(0x1234 >>> 9, ca.getTag());
        assertEquals(0x1234, AddressCodec.encodeCache(ca.getTag(), ca.getSetIndex(), ca.getOffset(), 16, 32));
        assertEquals(0x1230, AddressCodec.blockAddress(ca.getTag(), ca.getSetIndex(), 16, 32));
    }

    @Test
    public void singleSetHasNoIndexBits() {
        CacheAddress ca = AddressCodec.decodeCache(0x1234, 16, 1);
        assertEquals(0, ca.getSetIndex());
        assertEquals(0x4, ca.getOffset());
        assertEquals(0x123, ca.getTag(), "tag must hold every bit above the offset");
        for (long a = 0; a < 4096; a += 7)
            assertEquals(a, reencode(a, 16, 1), "addr=" + a);
    }

    @Test
    public void powerOfTwoRoundTrip() {
        int[][] dims = { { 16, 32 }, { 64, 128 }, { 1, 8 }, { 32, 2 } };
        for (int[] d : dims)
            for (long a = 0; a < 1 << 16; a += 13)
                assertEquals(a, reencode(a, d[0], d[1]), "block=" + d[0] + " sets=" + d[1] + " addr=" + a);
    }

    @Test
    public void nonPowerOfTwoSetsStayInRangeAndRoundTrip() {
        int[][] dims = { { 16, 3 }, { 16, 24 }, { 12, 5 }, { 64, 6 } };
        for (int[] d : dims) {
            for (long a = 0; a < 1 << 15; a++) {
                CacheAddress ca = AddressCodec.decodeCache(a, d[0], d[1]);
                assertTrue(ca.getSetIndex() >= 0 && ca.getSetIndex() < d[1], "set index out of range for " + a);
                assertEquals(a, reencode(a, d[0], d[1]), "block=" + d[0] + " sets=" + d[1] + " addr=" + a);
            }
        }
    }

    @Test
    public void foldedSetKeepsTagsDistinct() {
        // 3 sets need 2 index bits; field value 3 folds onto set 0
        CacheAddress plain = AddressCodec.decodeCache(0x00, 16, 3);
        CacheAddress folded = AddressCodec.decodeCache(0x30, 16, 3);
        assertEquals(plain.getSetIndex(), folded.getSetIndex());
        assertNotEquals(plain.getTag(), folded.getTag());
    }

    @Test
    public void bitsNeeded() {
        assertEquals(0, AddressCodec.bitsNeeded(1));
        assertEquals(1, AddressCodec.bitsNeeded(2));
        assertEquals(2, AddressCodec.bitsNeeded(3));
        assertEquals(5, AddressCodec.bitsNeeded(32));
        assertEquals(6, AddressCodec.bitsNeeded(33));
        assertTrue(AddressCodec.isPowerOfTwo(64));
        assertFalse(AddressCodec.isPowerOfTwo(48));
    }

    private static long reencode(long addr, int block, int sets) {
        CacheAddress ca = AddressCodec.decodeCache(addr, block, sets);
        return AddressCodec.encodeCache(ca.getTag(), ca.getSetIndex(), ca.getOffset(), block, sets);
    }
}
