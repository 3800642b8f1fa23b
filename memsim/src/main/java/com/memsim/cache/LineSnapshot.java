package com.memsim.cache;

/** Immutable (valid, tag, dirty) view of one cache line. */
public final class LineSnapshot {
    private final boolean valid;
    private final long tag;
    private final boolean dirty;

    public LineSnapshot(boolean valid, long tag, boolean dirty) {
        this.valid = valid;
        this.tag = tag;
        this.dirty = dirty;
    }

    public boolean isValid() {
        return valid;
    }

    public long getTag() {
        return tag;
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public String toString() {
        if (!valid)
            return "-";
        return String.format("0x%X%s", tag, dirty ? "*" : "");
    }
}
