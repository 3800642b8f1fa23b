package com.memsim.memory;

/**
 * Copy-out view of the controller: topology, cycle counter and the open row of
 * every bank (flattened channel-major, {@link DramBank#NO_OPEN_ROW} when
 * closed).
 */
public final class ControllerSnapshot {
    private final String topology;
    private final long currentCycle;
    private final int[] openRows;

    public ControllerSnapshot(String topology, long currentCycle, int[] openRows) {
        this.topology = topology;
        this.currentCycle = currentCycle;
        this.openRows = openRows.clone();
    }

    public String getTopology() {
        return topology;
    }

    public long getCurrentCycle() {
        return currentCycle;
    }

    public int[] getOpenRows() {
        return openRows.clone();
    }

    public int getOpenRow(int flatBankIndex) {
        return openRows[flatBankIndex];
    }

    public int getBankCount() {
        return openRows.length;
    }
}
