package com.memsim.memory;

/**
 * Address or length outside the modelled physical space, or past the end of a
 * bank row at the decoded column.
 */
public class OutOfBoundsException extends MemoryException {
    private final long address;
    private final int length;

    public OutOfBoundsException(long address, int length, String message) {
        super(message);
        this.address = address;
        this.length = length;
    }

    public long getAddress() {
        return address;
    }

    public int getLength() {
        return length;
    }
}
