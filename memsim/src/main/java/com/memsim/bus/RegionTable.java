package com.memsim.bus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.memsim.cache.BackingStore;
import com.memsim.memory.MemoryController;
import com.memsim.memory.MmioHandler;
import com.memsim.memory.OutOfBoundsException;
import com.memsim.memory.ReadResult;
import com.memsim.memory.RegionOverlapException;
import com.memsim.memory.RegionViolationException;
import com.memsim.memory.interfaces.PhysicalBus;

/**
 * Protection layer over the memory controller.
 *
 * Maps named regions (code, heap, stack, mmio, ...) with permissions over the
 * controller's physical space and checks every byte of an access against them
 * before delegating. Regions never overlap and never leave the physical space.
 * An access may span several contiguous regions as long as each one grants the
 * needed rights.
 *
 * Region bookkeeping has its own lock; it is never held while calling the
 * controller.
 */
public class RegionTable implements PhysicalBus, BackingStore {

    private static final Set<Permission> READ_ONLY = EnumSet.of(Permission.READ);
    private static final Set<Permission> WRITE_ONLY = EnumSet.of(Permission.WRITE);
    private static final Set<Permission> EXEC_ONLY = EnumSet.of(Permission.EXECUTE);

    private final MemoryController memCtrl;
    private final List<MemoryRegion> regions = new ArrayList<>();
    private final ReentrantReadWriteLock regionLock = new ReentrantReadWriteLock();

    public RegionTable(MemoryController controller) {
        this.memCtrl = Objects.requireNonNull(controller, "controller");
    }

    public MemoryController getController() {
        return memCtrl;
    }

    /** Size of the physical space: channels * ranks * banks * rows * cols. */
    public long computePhysicalSize() {
        return memCtrl.getPhysicalSize();
    }

    // --- mapping ---

    public MemoryRegion mapRegion(long start, long size, Set<Permission> perms, String name) {
        if (start < 0 || size <= 0 || start > computePhysicalSize() - size)
            throw new OutOfBoundsException(start, (int) Math.min(size, Integer.MAX_VALUE), String.format(
                    "Region %s 0x%X+0x%X outside physical space (size=0x%X)", name, start, size,
                    computePhysicalSize()));
        MemoryRegion region = new MemoryRegion(start, size, perms, name);
        regionLock.writeLock().lock();
        try {
            for (MemoryRegion r : regions) {
                if (r.overlaps(start, size))
                    throw new RegionOverlapException(
                            String.format("Region %s 0x%X+0x%X overlaps %s", name, start, size, r));
            }
            regions.add(region);
        } finally {
            regionLock.writeLock().unlock();
        }
        return region;
    }

    /**
     * Attach device handlers to a region previously mapped with exactly this
     * start and size.
     */
    public void registerMmioHandlers(long start, long size, MmioHandler handler) {
        MemoryRegion match = null;
        regionLock.readLock().lock();
        try {
            for (MemoryRegion r : regions) {
                if (r.getStart() == start && r.getSize() == size) {
                    match = r;
                    break;
                }
            }
        } finally {
            regionLock.readLock().unlock();
        }
        if (match == null)
            throw new RegionViolationException(start, null,
                    String.format("No mapped region 0x%X+0x%X to register MMIO on", start, size));
        memCtrl.registerMmioHandler(start, size, handler);
    }

    public MemoryRegion findRegion(long address) {
        regionLock.readLock().lock();
        try {
            return findRegionLocked(address);
        } finally {
            regionLock.readLock().unlock();
        }
    }

    public MemoryRegion findRegion(String name) {
        regionLock.readLock().lock();
        try {
            for (MemoryRegion r : regions) {
                if (r.getName().equals(name))
                    return r;
            }
            return null;
        } finally {
            regionLock.readLock().unlock();
        }
    }

    private MemoryRegion findRegionLocked(long address) {
        for (MemoryRegion r : regions) {
            if (r.contains(address))
                return r;
        }
        return null;
    }

    /** Copy of the mapped regions sorted by start address. */
    public List<MemoryRegion> getRegions() {
        regionLock.readLock().lock();
        try {
            List<MemoryRegion> copy = new ArrayList<>(regions);
            copy.sort(Comparator.comparingLong(MemoryRegion::getStart));
            return copy;
        } finally {
            regionLock.readLock().unlock();
        }
    }

    public List<String> describeRegions() {
        List<String> out = new ArrayList<>();
        for (MemoryRegion r : getRegions())
            out.add(r.toString());
        return out;
    }

    // --- permission check ---

    /**
     * Walk [address, address + length) region by region. Fails on the first
     * unmapped byte or on a region missing any of the needed rights.
     */
    public void checkAccess(long address, int length, Set<Permission> needed) {
        if (length < 0)
            throw new OutOfBoundsException(address, length, "Negative length " + length);
        if (address < 0 || address > computePhysicalSize() - length)
            throw new OutOfBoundsException(address, length, String.format(
                    "Access 0x%X+%d outside physical space (size=0x%X)", address, length, computePhysicalSize()));
        regionLock.readLock().lock();
        try {
            long cursor = address;
            long remaining = length;
            while (remaining > 0) {
                MemoryRegion r = findRegionLocked(cursor);
                if (r == null)
                    throw new RegionViolationException(cursor, null,
                            String.format("Address 0x%X is not mapped to any region", cursor));
                if (!r.allows(needed))
                    throw new RegionViolationException(cursor, r.getName(), String.format(
                            "Permission violation at 0x%X in region %s (needs %s, has %s)", cursor, r.getName(),
                            Permission.format(needed), Permission.format(r.getPermissions())));
                long avail = Math.min(remaining, r.getEnd() - cursor + 1);
                cursor += avail;
                remaining -= avail;
            }
        } finally {
            regionLock.readLock().unlock();
        }
    }

    // --- PhysicalBus ---

    @Override
    public ReadResult readBytes(long address, int length) {
        checkAccess(address, length, READ_ONLY);
        return memCtrl.readBytes(address, length);
    }

    @Override
    public int writeBytes(long address, byte[] data) {
        if (data == null || data.length == 0)
            return 0;
        checkAccess(address, data.length, WRITE_ONLY);
        return memCtrl.writeBytes(address, data);
    }

    /** Instruction fetch: like a read but needs EXECUTE. */
    public ReadResult fetchBytes(long address, int length) {
        checkAccess(address, length, EXEC_ONLY);
        return memCtrl.readBytes(address, length);
    }

    @Override
    public CompletableFuture<ReadResult> readBytesAsync(long address, int length) {
        checkAccess(address, length, READ_ONLY);
        return memCtrl.readBytesAsync(address, length);
    }

    @Override
    public CompletableFuture<Integer> writeBytesAsync(long address, byte[] data) {
        if (data == null || data.length == 0)
            return CompletableFuture.completedFuture(0);
        checkAccess(address, data.length, WRITE_ONLY);
        return memCtrl.writeBytesAsync(address, data);
    }

    // --- BackingStore ---

    /**
     * Cache write-back. The block was made dirty by a write that already passed
     * the WRITE check, so only the controller bounds apply here.
     */
    @Override
    public int writeBack(long blockAddress, int blockSize) {
        return memCtrl.writeBack(blockAddress, blockSize);
    }

    // --- debug helpers ---

    public String getTopologyInfo() {
        return memCtrl.getTopologyInfo();
    }

    public long getCurrentCycle() {
        return memCtrl.getCurrentCycle();
    }
}
