package com.memsim.memory;

/**
 * Stateless address decomposition.
 *
 * DRAM: column is the fastest varying field, then row, bank, rank and channel
 * (successive modulo/divide). Cache: low bits are the block offset, the next
 * bits select the set, the remaining high bits form the tag.
 *
 * Cache dimensions that are not powers of two use the minimal bit width able to
 * represent them. A set field value that lands past the last set is folded
 * back by subtracting the set count, and the fold is recorded in the low bit of
 * the tag so two addresses never alias the same (tag, set) pair.
 */
public final class AddressCodec {

    private AddressCodec() {
    }

    // --- DRAM ---

    public static DramAddress decodeDram(long address, DramGeometry g) {
        if (address < 0 || address >= g.getPhysicalSize())
            throw new OutOfBoundsException(address, 1, String.format(
                    "Address 0x%X outside physical space (size=0x%X)", address, g.getPhysicalSize()));
        long a = address;
        int col = (int) (a % g.getColsPerRow());
        a /= g.getColsPerRow();
        int row = (int) (a % g.getRowsPerBank());
        a /= g.getRowsPerBank();
        int bank = (int) (a % g.getBanksPerRank());
        a /= g.getBanksPerRank();
        int rank = (int) (a % g.getRanksPerChannel());
        a /= g.getRanksPerChannel();
        int channel = (int) (a % g.getChannels());
        return new DramAddress(channel, rank, bank, row, col);
    }

    public static long encodeDram(DramAddress d, DramGeometry g) {
        if (d.getChannel() < 0 || d.getChannel() >= g.getChannels() || d.getRank() < 0
                || d.getRank() >= g.getRanksPerChannel() || d.getBank() < 0 || d.getBank() >= g.getBanksPerRank()
                || d.getRow() < 0 || d.getRow() >= g.getRowsPerBank() || d.getColumn() < 0
                || d.getColumn() >= g.getColsPerRow())
            throw new OutOfBoundsException(-1, 1, "DRAM coordinates outside geometry: " + d);
        long a = d.getChannel();
        a = a * g.getRanksPerChannel() + d.getRank();
        a = a * g.getBanksPerRank() + d.getBank();
        a = a * g.getRowsPerBank() + d.getRow();
        a = a * g.getColsPerRow() + d.getColumn();
        return a;
    }

    // --- Cache ---

    public static CacheAddress decodeCache(long address, int blockSize, int numSets) {
        int offsetBits = bitsNeeded(blockSize);
        int setBits = bitsNeeded(numSets);
        int offset = (int) (address & mask(offsetBits));
        int field = (int) ((address >>> offsetBits) & mask(setBits));
        long high = address >>> (offsetBits + setBits);
        if (isPowerOfTwo(numSets))
            return new CacheAddress(high, field, offset);
        boolean folded = field >= numSets;
        int setIndex = folded ? field - numSets : field;
        long tag = (high << 1) | (folded ? 1L : 0L);
        return new CacheAddress(tag, setIndex, offset);
    }

    public static long encodeCache(long tag, int setIndex, int offset, int blockSize, int numSets) {
        int offsetBits = bitsNeeded(blockSize);
        int setBits = bitsNeeded(numSets);
        long high;
        int field;
        if (isPowerOfTwo(numSets)) {
            high = tag;
            field = setIndex;
        } else {
            high = tag >>> 1;
            field = setIndex + ((tag & 1L) != 0 ? numSets : 0);
        }
        return (high << (offsetBits + setBits)) | ((long) field << offsetBits) | (offset & mask(offsetBits));
    }

    /** Address of the first byte of the block holding (tag, setIndex). */
    public static long blockAddress(long tag, int setIndex, int blockSize, int numSets) {
        return encodeCache(tag, setIndex, 0, blockSize, numSets);
    }

    // --- helpers ---

    /** Minimal bit width w such that (1 << w) >= value; 0 for value <= 1. */
    public static int bitsNeeded(int value) {
        int bits = 0;
        while ((1L << bits) < value)
            bits++;
        return bits;
    }

    public static boolean isPowerOfTwo(int value) {
        return value > 0 && (value & (value - 1)) == 0;
    }

    private static long mask(int bits) {
        return bits == 0 ? 0L : (1L << bits) - 1;
    }
}
