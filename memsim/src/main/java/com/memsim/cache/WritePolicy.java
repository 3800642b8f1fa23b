package com.memsim.cache;

import java.util.Locale;

import com.memsim.memory.InvalidConfigurationException;

/** When a cached write reaches the backing store. */
public enum WritePolicy {
    /** Mark the line dirty; flush once when it is evicted. */
    WRITE_BACK,
    /** Every write goes to the backing store; lines are never dirty. */
    WRITE_THROUGH;

    public static WritePolicy parse(String text) {
        if (text == null)
            throw new InvalidConfigurationException("Missing write policy");
        switch (text.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "")) {
            case "WB", "WRITEBACK" -> {
                return WRITE_BACK;
            }
            case "WT", "WRITETHROUGH" -> {
                return WRITE_THROUGH;
            }
            default -> throw new InvalidConfigurationException("Unknown write policy: " + text + " (WB|WT)");
        }
    }
}
