package com.memsim.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.memsim.cache.AccessGranularity;
import com.memsim.cache.CacheConfig;
import com.memsim.cache.ReplacementPolicy;
import com.memsim.cache.WritePolicy;
import com.memsim.memory.DramGeometry;
import com.memsim.memory.DramTiming;
import com.memsim.memory.InvalidConfigurationException;
import com.memsim.memory.MemoryController;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Full description of a simulated memory system. Defaults give one channel,
 * one rank, 8 banks of 256 rows x 512 columns (1 MiB), the default timing and a
 * 16 KiB 2-way write-back LRU cache with 64-byte blocks.
 *
 * Values come from memsim.ini ({@link #fromIni(IniFile)}) and may be
 * overridden afterwards by CLI options ({@link AppOptions#applyTo}).
 */
public class MemoryConfig {

    // --- DRAM geometry ---
    public int channels = 1;
    public int ranks = 1;
    public int banks = 8;
    public int rows = 256;
    public int cols = 512;

    // --- DRAM timing (cycles) ---
    public int tCL = 12;
    public int tRCD = 12;
    public int tRP = 12;
    public int tRAS = 30;
    public int tRFC = 350;
    public int tBurst = 4;

    /** Async pacing scale (ms per cycle). */
    public double cycleToMillis = MemoryController.DEFAULT_CYCLE_TO_MS;

    // --- cache ---
    public boolean cacheEnabled = true;
    public int cacheSize = 16 * 1024;
    public int cacheBlock = 64;
    /** Ways per set; 0 = fully associative. */
    public int cacheAssoc = 2;
    public ReplacementPolicy replacement = ReplacementPolicy.LRU;
    public WritePolicy writePolicy = WritePolicy.WRITE_BACK;
    public AccessGranularity granularity = AccessGranularity.BYTE;

    // --- regions / devices ---
    public final List<RegionSpec> regions = new ArrayList<>();
    /** Start of the MMIO buffer device, null when no device is attached. */
    public Long mmioStart = null;
    public long mmioSize = 0;
    public int mmioCycles = 1;

    /** Pause between DMA bytes (ms). */
    public long dmaDelayMs = 0;

    /**
     * Read every known key from the INI; missing keys keep their default.
     *
     * @throws InvalidConfigurationException on a malformed value
     */
    public static MemoryConfig fromIni(IniFile ini) {
        MemoryConfig c = new MemoryConfig();
        if (ini == null)
            return c;
        c.channels = intOpt(ini, "dram.channels", c.channels);
        c.ranks = intOpt(ini, "dram.ranks", c.ranks);
        c.banks = intOpt(ini, "dram.banks", c.banks);
        c.rows = intOpt(ini, "dram.rows", c.rows);
        c.cols = intOpt(ini, "dram.cols", c.cols);

        c.tCL = intOpt(ini, "dram.tCL", c.tCL);
        c.tRCD = intOpt(ini, "dram.tRCD", c.tRCD);
        c.tRP = intOpt(ini, "dram.tRP", c.tRP);
        c.tRAS = intOpt(ini, "dram.tRAS", c.tRAS);
        c.tRFC = intOpt(ini, "dram.tRFC", c.tRFC);
        c.tBurst = intOpt(ini, "dram.tBurst", c.tBurst);
        if (ini.hasOption("dram.cycle-to-ms"))
            c.cycleToMillis = ConfigUtils.parseDouble(ini.getOption("dram.cycle-to-ms"), "dram.cycle-to-ms");

        if (ini.hasOption("cache.enabled"))
            c.cacheEnabled = ConfigUtils.parseBoolean(ini.getOption("cache.enabled"), "cache.enabled");
        if (ini.hasOption("cache.size"))
            c.cacheSize = ConfigUtils.parseIntSize(ini.getOption("cache.size"), "cache.size");
        if (ini.hasOption("cache.block"))
            c.cacheBlock = ConfigUtils.parseIntSize(ini.getOption("cache.block"), "cache.block");
        c.cacheAssoc = intOpt(ini, "cache.assoc", c.cacheAssoc);
        if (ini.hasOption("cache.replacement"))
            c.replacement = ReplacementPolicy.parse(ini.getOption("cache.replacement"));
        if (ini.hasOption("cache.write"))
            c.writePolicy = WritePolicy.parse(ini.getOption("cache.write"));
        if (ini.hasOption("cache.granularity"))
            c.granularity = AccessGranularity.parse(ini.getOption("cache.granularity"));

        for (String key : ini.keysWithPrefix("region.")) {
            String name = key.substring("region.".length());
            if (name.isEmpty())
                throw new InvalidConfigurationException("Region entry without a name: " + key);
            c.regions.add(RegionSpec.parse(name, ini.getOption(key)));
        }

        if (ini.hasOption("mmio.start"))
            c.mmioStart = ConfigUtils.parseLong(ini.getOption("mmio.start"), "mmio.start");
        if (ini.hasOption("mmio.size"))
            c.mmioSize = ConfigUtils.parseSize(ini.getOption("mmio.size"), "mmio.size");
        c.mmioCycles = intOpt(ini, "mmio.cycles", c.mmioCycles);

        if (ini.hasOption("dma.delay-ms"))
            c.dmaDelayMs = ConfigUtils.parseLong(ini.getOption("dma.delay-ms"), "dma.delay-ms");

        Log.debug(CONFIG, "Config loaded from %s (%d region(s))", ini.getSource(), c.regions.size());
        return c;
    }

    private static int intOpt(IniFile ini, String key, int def) {
        return ini.hasOption(key) ? ConfigUtils.parseInt(ini.getOption(key), key) : def;
    }

    /**
     * Check everything that construction would reject, plus the cross-field
     * rules (regions inside the physical space and not overlapping, MMIO
     * device matching a region).
     *
     * @throws InvalidConfigurationException on the first problem found
     */
    public void validate() {
        DramGeometry g = toGeometry();
        toTiming();
        if (cycleToMillis < 0 || Double.isNaN(cycleToMillis))
            throw new InvalidConfigurationException("dram.cycle-to-ms must be >= 0 (got " + cycleToMillis + ")");
        if (cacheEnabled)
            toCacheConfig();
        long physical = g.getPhysicalSize();
        for (int i = 0; i < regions.size(); i++) {
            RegionSpec r = regions.get(i);
            if (r.getStart() < 0 || r.getSize() <= 0 || r.getStart() > physical - r.getSize())
                throw new InvalidConfigurationException(String.format(
                        "Region %s 0x%X+0x%X outside physical space (size=0x%X)", r.getName(), r.getStart(),
                        r.getSize(), physical));
            for (int j = 0; j < i; j++) {
                RegionSpec o = regions.get(j);
                if (r.getStart() < o.getStart() + o.getSize() && o.getStart() < r.getStart() + r.getSize())
                    throw new InvalidConfigurationException(
                            "Region " + r.getName() + " overlaps region " + o.getName());
            }
        }
        if (mmioStart != null) {
            if (mmioSize <= 0 || mmioSize > Integer.MAX_VALUE)
                throw new InvalidConfigurationException("mmio.size must be in [1, 2^31) (got " + mmioSize + ")");
            if (mmioCycles < 0)
                throw new InvalidConfigurationException("mmio.cycles must be >= 0 (got " + mmioCycles + ")");
            boolean matched = false;
            for (RegionSpec r : regions) {
                if (r.getStart() == mmioStart && r.getSize() == mmioSize)
                    matched = true;
            }
            if (!matched)
                throw new InvalidConfigurationException(String.format(
                        "MMIO device 0x%X+0x%X does not match any configured region", mmioStart, mmioSize));
        }
        if (dmaDelayMs < 0)
            throw new InvalidConfigurationException("dma.delay-ms must be >= 0 (got " + dmaDelayMs + ")");
    }

    public DramGeometry toGeometry() {
        return new DramGeometry(channels, ranks, banks, rows, cols);
    }

    public DramTiming toTiming() {
        return new DramTiming(tCL, tRCD, tRP, tRAS, tRFC, tBurst);
    }

    public CacheConfig toCacheConfig() {
        if (cacheAssoc < 0)
            throw new InvalidConfigurationException("cache.assoc must be >= 0 (got " + cacheAssoc + ")");
        if (cacheAssoc == 0) {
            if (cacheBlock <= 0)
                throw new InvalidConfigurationException("Block size must be positive (got " + cacheBlock + ")");
            return new CacheConfig(cacheSize, cacheBlock, Math.max(1, cacheSize / cacheBlock), replacement,
                    writePolicy, granularity);
        }
        return new CacheConfig(cacheSize, cacheBlock, cacheAssoc, replacement, writePolicy, granularity);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "DRAM %dch/%drk/%dbk %dx%d | tCL=%d tRCD=%d tRP=%d tRAS=%d tRFC=%d tBurst=%d | cache=%s | regions=%s",
                channels, ranks, banks, rows, cols, tCL, tRCD, tRP, tRAS, tRFC, tBurst,
                cacheEnabled ? cacheSize + "B/" + cacheBlock + "B/" + cacheAssoc + "-way " + replacement + " "
                        + writePolicy : "off",
                regions);
    }
}
