package com.memsim.memory;

/** A region (or MMIO range) registration that would overlap an existing one. */
public class RegionOverlapException extends MemoryException {

    public RegionOverlapException(String message) {
        super(message);
    }
}
