package com.memsim.system;

import com.memsim.bus.Bus;
import com.memsim.bus.RegionTable;
import com.memsim.cache.CacheEngine;
import com.memsim.cache.CacheStats;
import com.memsim.config.MemoryConfig;
import com.memsim.config.RegionSpec;
import com.memsim.dma.DmaController;
import com.memsim.dma.MmioBufferDevice;
import com.memsim.memory.MemoryController;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Memory system façade. Builds the whole stack from a {@link MemoryConfig}:
 * controller, region table with the configured regions, optional MMIO buffer
 * device, optional cache, the system bus and the DMA engine.
 */
public class MemorySystem implements AutoCloseable {
    private final MemoryConfig config;
    private final MemoryController controller;
    private final RegionTable regions;
    private final CacheEngine cache; // null when disabled
    private final MmioBufferDevice device; // null when not configured
    private final Bus bus;
    private final DmaController dma;

    /**
     * @throws com.memsim.memory.InvalidConfigurationException if the config does
     *                                                         not validate
     */
    public MemorySystem(MemoryConfig config) {
        config.validate();
        this.config = config;
        this.controller = new MemoryController(config.toGeometry(), config.toTiming(), config.cycleToMillis);
        this.regions = new RegionTable(controller);
        for (RegionSpec r : config.regions)
            regions.mapRegion(r.getStart(), r.getSize(), r.getPermissions(), r.getName());
        if (config.mmioStart != null) {
            this.device = new MmioBufferDevice(config.mmioStart, (int) config.mmioSize, config.mmioCycles);
            regions.registerMmioHandlers(config.mmioStart, config.mmioSize, device);
        } else {
            this.device = null;
        }
        this.cache = config.cacheEnabled ? new CacheEngine(config.toCacheConfig(), regions) : null;
        this.bus = new Bus(regions, cache);
        this.dma = new DmaController(bus, config.dmaDelayMs);
        Log.info(GENERAL, "Memory system: %s, %d region(s), cache %s", controller.getTopologyInfo(),
                config.regions.size(), cache != null ? cache.getTopologyInfo() : "off");
    }

    public MemoryConfig getConfig() {
        return config;
    }

    public MemoryController getController() {
        return controller;
    }

    public RegionTable getRegions() {
        return regions;
    }

    /** Cache or null when disabled. */
    public CacheEngine getCache() {
        return cache;
    }

    /** MMIO buffer device or null when not configured. */
    public MmioBufferDevice getDevice() {
        return device;
    }

    public Bus getBus() {
        return bus;
    }

    public DmaController getDma() {
        return dma;
    }

    /** Cache counters, or null when running uncached. */
    public CacheStats getCacheStats() {
        return cache != null ? cache.getStats() : null;
    }

    /** Back to power-on: zeroed DRAM, closed banks, empty cache, cleared device. */
    public void reset() {
        if (dma.isBusy())
            throw new IllegalStateException("Cannot reset while a DMA transfer is running");
        controller.reset();
        if (cache != null)
            cache.reset();
        if (device != null)
            device.clear();
    }

    @Override
    public void close() {
        dma.close();
    }
}
