package com.memsim.cache;

import java.util.Locale;

import com.memsim.memory.InvalidConfigurationException;

/**
 * How a multi-byte bus access is charged to the cache counters.
 */
public enum AccessGranularity {
    /** One cache access per byte touched. */
    BYTE,
    /** One cache access per distinct block touched. */
    BLOCK;

    public static AccessGranularity parse(String text) {
        if (text == null)
            throw new InvalidConfigurationException("Missing access granularity");
        switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "BYTE" -> {
                return BYTE;
            }
            case "BLOCK" -> {
                return BLOCK;
            }
            default -> throw new InvalidConfigurationException("Unknown access granularity: " + text + " (BYTE|BLOCK)");
        }
    }
}
