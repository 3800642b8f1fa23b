package com.memsim.memory;

import java.util.Arrays;

/** Bytes returned by a read together with the cycles the read cost. */
public final class ReadResult {
    private static final byte[] NO_DATA = new byte[0];
    public static final ReadResult EMPTY = new ReadResult(NO_DATA, 0);

    private final byte[] data;
    private final int cycles;

    public ReadResult(byte[] data, int cycles) {
        this.data = data == null ? NO_DATA : data.clone();
        this.cycles = cycles;
    }

    /** Copy of the bytes read. */
    public byte[] getData() {
        return data.clone();
    }

    /** Unsigned byte at index i. */
    public int get(int i) {
        return data[i] & 0xFF;
    }

    public int length() {
        return data.length;
    }

    public int getCycles() {
        return cycles;
    }

    @Override
    public String toString() {
        return "ReadResult{len=" + data.length + ", cycles=" + cycles + ", data=" + Arrays.toString(data) + "}";
    }
}
