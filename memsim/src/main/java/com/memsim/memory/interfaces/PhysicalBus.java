package com.memsim.memory.interfaces;

import java.util.concurrent.CompletableFuture;

import com.memsim.memory.ReadResult;

/**
 * Byte-level bus contract shared by the memory controller and the region
 * table in front of it. Every call returns (or carries) the cycles the access
 * cost.
 */
public interface PhysicalBus {

    /**
     * Read length bytes starting at address.
     *
     * @return the bytes plus the cycle cost; zero-length reads cost nothing
     */
    ReadResult readBytes(long address, int length);

    /**
     * Write data starting at address.
     *
     * @return the cycle cost; empty writes cost nothing
     */
    int writeBytes(long address, byte[] data);

    /**
     * Same effect as {@link #readBytes(long, int)}, committed before this
     * method returns; the future completes after a delay proportional to the
     * cycle cost. Cancelling the future only suppresses delivery of the result:
     * the memory effect has already happened.
     */
    CompletableFuture<ReadResult> readBytesAsync(long address, int length);

    /**
     * Same effect as {@link #writeBytes(long, byte[])}, committed before this
     * method returns; the future paces delivery of the cycle count. Cancelling
     * it does not undo the write.
     */
    CompletableFuture<Integer> writeBytesAsync(long address, byte[] data);
}
