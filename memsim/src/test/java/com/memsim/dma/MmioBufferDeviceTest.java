package com.memsim.dma;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.memsim.memory.InvalidConfigurationException;

public class MmioBufferDeviceTest {

    @Test
    public void bytesAreAppendedAndWrapAround() {
        MmioBufferDevice dev = new MmioBufferDevice(0x100, 4, 2);
        assertEquals(2, dev.write(0x100, new byte[] { 1, 2, 3 }));
        assertEquals(3, dev.getWritePosition());
        dev.write(0x103, new byte[] { 4, 5 });
        assertArrayEquals(new byte[] { 5, 2, 3, 4 }, dev.getBufferSnapshot());
        assertEquals(5, dev.getBytesReceived());
    }

    @Test
    public void readsByOffsetInsideRange() {
        MmioBufferDevice dev = new MmioBufferDevice(0x100, 4, 7);
        dev.write(0x100, new byte[] { 10, 20, 30, 40 });
        var r = dev.read(0x102, 2);
        assertArrayEquals(new byte[] { 30, 40 }, r.getData());
        assertEquals(7, r.getCycles());
    }

    @Test
    public void snapshotIsACopy() {
        MmioBufferDevice dev = new MmioBufferDevice(0, 2, 1);
        byte[] snap = dev.getBufferSnapshot();
        snap[0] = 99;
        assertEquals(0, dev.getBufferSnapshot()[0]);
    }

    @Test
    public void rangeAndValidation() {
        MmioBufferDevice dev = new MmioBufferDevice(0x100, 16, 1);
        assertEquals(0x10F, dev.getEnd());
        assertTrue(dev.inRange(0x10F));
        assertFalse(dev.inRange(0x110));
        assertThrows(InvalidConfigurationException.class, () -> new MmioBufferDevice(0, 0, 1));
        assertThrows(InvalidConfigurationException.class, () -> new MmioBufferDevice(0, 4, -1));
    }

    @Test
    public void clearResetsCursor() {
        MmioBufferDevice dev = new MmioBufferDevice(0, 4, 1);
        dev.write(0, new byte[] { 1, 2 });
        dev.clear();
        assertEquals(0, dev.getWritePosition());
        assertEquals(0, dev.getBytesReceived());
        assertArrayEquals(new byte[4], dev.getBufferSnapshot());
    }
}
