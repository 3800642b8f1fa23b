package com.memsim.memory;

/** Decoded (tag, set index, block offset) of a physical address. */
public final class CacheAddress {
    private final long tag;
    private final int setIndex;
    private final int offset;

    public CacheAddress(long tag, int setIndex, int offset) {
        this.tag = tag;
        this.setIndex = setIndex;
        this.offset = offset;
    }

    public long getTag() {
        return tag;
    }

    public int getSetIndex() {
        return setIndex;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CacheAddress))
            return false;
        CacheAddress other = (CacheAddress) o;
        return tag == other.tag && setIndex == other.setIndex && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return (int) (tag ^ (tag >>> 32)) * 31 * 31 + setIndex * 31 + offset;
    }

    @Override
    public String toString() {
        return String.format("tag=0x%X set=%d offset=%d", tag, setIndex, offset);
    }
}
