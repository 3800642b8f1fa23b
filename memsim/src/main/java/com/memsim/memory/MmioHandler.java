package com.memsim.memory;

/**
 * Device mapped into the physical address space. The controller hands the
 * whole access to the device, bypassing DRAM, and charges the cycles the
 * device reports.
 */
public interface MmioHandler {

    /**
     * Device read.
     *
     * @param address physical address (inside the registered range)
     * @param length  number of bytes requested
     * @return data plus the cycle cost of the access
     */
    ReadResult read(long address, int length);

    /**
     * Device write.
     *
     * @param address physical address (inside the registered range)
     * @param data    bytes written
     * @return cycle cost of the access
     */
    int write(long address, byte[] data);
}
