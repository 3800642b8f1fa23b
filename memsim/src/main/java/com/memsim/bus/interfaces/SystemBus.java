package com.memsim.bus.interfaces;

import java.util.concurrent.CompletableFuture;

import com.memsim.memory.ReadResult;

/**
 * Processor-facing bus: what a CPU model, a DMA engine or a trace runner sees.
 * Every access is permission-checked against the mapped regions and, when a
 * cache is configured, charged to it before reaching memory.
 */
public interface SystemBus {

    /**
     * Read one byte.
     *
     * @param address physical address
     * @return unsigned byte (0-255)
     */
    default int read(long address) {
        return readBytes(address, 1).get(0);
    }

    /**
     * Write one byte.
     *
     * @param address physical address
     * @param value   byte value (low 8 bits used)
     */
    default void write(long address, int value) {
        writeBytes(address, new byte[] { (byte) value });
    }

    ReadResult readBytes(long address, int length);

    /** @return cycle cost of the write */
    int writeBytes(long address, byte[] data);

    /** Instruction fetch; needs EXECUTE on every byte. */
    ReadResult fetch(long address, int length);

    CompletableFuture<ReadResult> readBytesAsync(long address, int length);

    CompletableFuture<Integer> writeBytesAsync(long address, byte[] data);
}
