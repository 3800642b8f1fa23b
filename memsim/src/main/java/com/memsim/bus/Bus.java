package com.memsim.bus;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.memsim.bus.interfaces.SystemBus;
import com.memsim.cache.CacheEngine;
import com.memsim.memory.MemoryController;
import com.memsim.memory.ReadResult;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * System bus: region table + optional cache in front of the controller.
 *
 * Responsibilities:
 * - Reject an access (permissions, unmapped bytes, controller bounds) before
 * anything is counted, so a faulting access leaves cache and DRAM untouched.
 * - Charge accesses that land in DRAM to the cache, per byte or per block
 * depending on the cache granularity. Device (MMIO) ranges are uncached.
 * - Delegate the data transfer to the region table.
 */
public class Bus implements SystemBus {

    private static final Set<Permission> READ = EnumSet.of(Permission.READ);
    private static final Set<Permission> WRITE = EnumSet.of(Permission.WRITE);
    private static final Set<Permission> EXECUTE = EnumSet.of(Permission.EXECUTE);

    private final RegionTable regions;
    private final MemoryController memCtrl;
    private final CacheEngine cache; // null = uncached

    public Bus(RegionTable regions) {
        this(regions, null);
    }

    public Bus(RegionTable regions, CacheEngine cache) {
        this.regions = Objects.requireNonNull(regions, "regions");
        this.memCtrl = regions.getController();
        this.cache = cache;
        Log.debug(BUS, "Bus ready (cache=%s)", cache != null ? cache.getConfig() : "off");
    }

    public RegionTable getRegions() {
        return regions;
    }

    public MemoryController getController() {
        return memCtrl;
    }

    /** Attached cache or null. */
    public CacheEngine getCache() {
        return cache;
    }

    @Override
    public ReadResult readBytes(long address, int length) {
        admit(address, length, READ, false);
        return regions.readBytes(address, length);
    }

    @Override
    public int writeBytes(long address, byte[] data) {
        if (data == null || data.length == 0)
            return 0;
        admit(address, data.length, WRITE, true);
        return regions.writeBytes(address, data);
    }

    @Override
    public ReadResult fetch(long address, int length) {
        admit(address, length, EXECUTE, false);
        return regions.fetchBytes(address, length);
    }

    @Override
    public CompletableFuture<ReadResult> readBytesAsync(long address, int length) {
        admit(address, length, READ, false);
        return regions.readBytesAsync(address, length);
    }

    @Override
    public CompletableFuture<Integer> writeBytesAsync(long address, byte[] data) {
        if (data == null || data.length == 0)
            return CompletableFuture.completedFuture(0);
        admit(address, data.length, WRITE, true);
        return regions.writeBytesAsync(address, data);
    }

    private void admit(long address, int length, Set<Permission> needed, boolean isWrite) {
        regions.checkAccess(address, length, needed);
        memCtrl.checkBounds(address, length);
        if (cache != null && length > 0 && !memCtrl.isMmio(address))
            cache.accessRange(address, length, isWrite);
    }
}
