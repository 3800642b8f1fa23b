package com.memsim.memory;

/**
 * Fire-and-forget notifications from the memory controller, for metrics and
 * UI. Called after the access has committed; implementations must not call
 * back into the controller expecting to block it.
 */
public interface MemoryObserver {

    default void onRead(long address, int length) {
    }

    default void onWrite(long address, int length) {
    }

    default void onRowBufferHit(int channel, int rank, int bank, int row) {
    }

    default void onRefreshStarted() {
    }
}
