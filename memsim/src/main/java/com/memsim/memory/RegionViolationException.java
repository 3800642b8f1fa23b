package com.memsim.memory;

/**
 * Access to an unmapped address, or to a mapped region that lacks a required
 * permission. Distinct from {@link OutOfBoundsException}: the memory may exist
 * but is protected.
 */
public class RegionViolationException extends MemoryException {
    private final long address;
    private final String regionName;

    public RegionViolationException(long address, String regionName, String message) {
        super(message);
        this.address = address;
        this.regionName = regionName;
    }

    public long getAddress() {
        return address;
    }

    /** Name of the region that denied the access, null when unmapped. */
    public String getRegionName() {
        return regionName;
    }

    public boolean isUnmapped() {
        return regionName == null;
    }
}
