package com.memsim.cache;

import java.util.Locale;

import com.memsim.memory.InvalidConfigurationException;

/** Victim selection when a set has no invalid line. */
public enum ReplacementPolicy {
    /** Evict the line with the oldest last use. */
    LRU,
    /** Evict the line inserted first; hits do not protect it. */
    FIFO;

    public static ReplacementPolicy parse(String text) {
        if (text == null)
            throw new InvalidConfigurationException("Missing replacement policy");
        switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "LRU" -> {
                return LRU;
            }
            case "FIFO" -> {
                return FIFO;
            }
            default -> throw new InvalidConfigurationException("Unknown replacement policy: " + text + " (LRU|FIFO)");
        }
    }
}
