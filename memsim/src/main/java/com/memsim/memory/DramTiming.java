package com.memsim.memory;

/**
 * DRAM timing parameters in abstract controller cycles.
 * <ul>
 * <li>tCL - CAS latency</li>
 * <li>tRCD - RAS to CAS delay (row activation)</li>
 * <li>tRP - row precharge</li>
 * <li>tRAS - row active time (informational only)</li>
 * <li>tRFC - refresh cycle time</li>
 * <li>tBurst - burst length in cycles</li>
 * </ul>
 */
public final class DramTiming {
    private final int casLatency;
    private final int rasToCasDelay;
    private final int rowPrechargeTime;
    private final int rowActiveTime;
    private final int refreshCycleTime;
    private final int burstLength;

    public DramTiming(int casLatency, int rasToCasDelay, int rowPrechargeTime, int rowActiveTime,
            int refreshCycleTime, int burstLength) {
        requireNonNegative("tCL", casLatency);
        requireNonNegative("tRCD", rasToCasDelay);
        requireNonNegative("tRP", rowPrechargeTime);
        requireNonNegative("tRAS", rowActiveTime);
        requireNonNegative("tRFC", refreshCycleTime);
        requireNonNegative("tBurst", burstLength);
        this.casLatency = casLatency;
        this.rasToCasDelay = rasToCasDelay;
        this.rowPrechargeTime = rowPrechargeTime;
        this.rowActiveTime = rowActiveTime;
        this.refreshCycleTime = refreshCycleTime;
        this.burstLength = burstLength;
    }

    /** tCL=12, tRCD=12, tRP=12, tRAS=30, tRFC=350, tBurst=4. */
    public static DramTiming defaults() {
        return new DramTiming(12, 12, 12, 30, 350, 4);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0)
            throw new InvalidConfigurationException(name + " must not be negative (got " + value + ")");
    }

    public int getCasLatency() {
        return casLatency;
    }

    public int getRasToCasDelay() {
        return rasToCasDelay;
    }

    public int getRowPrechargeTime() {
        return rowPrechargeTime;
    }

    public int getRowActiveTime() {
        return rowActiveTime;
    }

    public int getRefreshCycleTime() {
        return refreshCycleTime;
    }

    public int getBurstLength() {
        return burstLength;
    }

    /** Cost of the column access itself once the row is open. */
    public int columnAccessCost() {
        return casLatency + burstLength;
    }

    @Override
    public String toString() {
        return String.format("tCL=%d tRCD=%d tRP=%d tRAS=%d tRFC=%d tBurst=%d", casLatency, rasToCasDelay,
                rowPrechargeTime, rowActiveTime, refreshCycleTime, burstLength);
    }
}
