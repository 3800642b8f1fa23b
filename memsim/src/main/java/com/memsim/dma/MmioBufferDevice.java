package com.memsim.dma;

import java.util.Arrays;

import com.memsim.memory.InvalidConfigurationException;
import com.memsim.memory.MmioHandler;
import com.memsim.memory.ReadResult;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Simple memory-mapped device backed by a byte ring buffer.
 *
 * Written bytes are appended at the write cursor, which wraps to the start of
 * the buffer once it is full. Reads return the buffer content at the offset of
 * the address inside the device range. Every access costs a fixed number of
 * cycles.
 */
public class MmioBufferDevice implements MmioHandler {

    private final long start;
    private final byte[] buffer;
    private final int cyclesPerAccess;
    private int writePos = 0;
    private long bytesReceived = 0;

    public MmioBufferDevice(long start, int size, int cyclesPerAccess) {
        if (start < 0 || size <= 0)
            throw new InvalidConfigurationException(
                    String.format("MMIO device needs start >= 0 and size > 0 (start=0x%X, size=%d)", start, size));
        if (cyclesPerAccess < 0)
            throw new InvalidConfigurationException("MMIO cycle cost must be >= 0 (got " + cyclesPerAccess + ")");
        this.start = start;
        this.buffer = new byte[size];
        this.cyclesPerAccess = cyclesPerAccess;
    }

    public long getStart() {
        return start;
    }

    public int getSize() {
        return buffer.length;
    }

    /** Inclusive end address. */
    public long getEnd() {
        return start + buffer.length - 1;
    }

    public boolean inRange(long address) {
        return address >= start && address <= getEnd();
    }

    @Override
    public synchronized ReadResult read(long address, int length) {
        byte[] out = new byte[length];
        int offset = (int) (address - start);
        for (int i = 0; i < length; i++)
            out[i] = buffer[Math.floorMod(offset + i, buffer.length)];
        return new ReadResult(out, cyclesPerAccess);
    }

    @Override
    public synchronized int write(long address, byte[] data) {
        for (byte b : data) {
            if (writePos >= buffer.length)
                writePos = 0;
            buffer[writePos++] = b;
        }
        bytesReceived += data.length;
        Log.trace(MMIO, "Device 0x%X received %d byte(s), cursor=%d", start, data.length, writePos);
        return cyclesPerAccess;
    }

    /** Copy of the whole ring buffer. */
    public synchronized byte[] getBufferSnapshot() {
        return buffer.clone();
    }

    public synchronized int getWritePosition() {
        return writePos;
    }

    public synchronized long getBytesReceived() {
        return bytesReceived;
    }

    public synchronized void clear() {
        Arrays.fill(buffer, (byte) 0);
        writePos = 0;
        bytesReceived = 0;
    }
}
