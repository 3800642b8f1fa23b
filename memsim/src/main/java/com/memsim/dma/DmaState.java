package com.memsim.dma;

import java.time.Instant;

/**
 * Mutable progress record of the DMA controller. All transitions are
 * synchronized; readers take an immutable {@link DmaSnapshot}.
 */
public class DmaState {
    private boolean running;
    private boolean completed;
    private long source;
    private long destination;
    private int length;
    private int bytesTransferred;
    private Instant startedAt;
    private Instant finishedAt;
    private String message = "Idle";

    /**
     * Claim the channel for a new transfer.
     *
     * @return false if a transfer is already running (state left untouched)
     */
    synchronized boolean tryStart(long source, long destination, int length) {
        if (running)
            return false;
        this.running = true;
        this.completed = false;
        this.source = source;
        this.destination = destination;
        this.length = length;
        this.bytesTransferred = 0;
        this.startedAt = Instant.now();
        this.finishedAt = null;
        this.message = "Running";
        return true;
    }

    synchronized void reportProgress(int bytes) {
        this.bytesTransferred = bytes;
    }

    synchronized void complete() {
        running = false;
        completed = true;
        finishedAt = Instant.now();
        message = "Completed";
    }

    synchronized void fail(String reason) {
        running = false;
        completed = false;
        finishedAt = Instant.now();
        message = reason;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized DmaSnapshot getSnapshot() {
        return new DmaSnapshot(running, completed, source, destination, length, bytesTransferred, startedAt,
                finishedAt, message);
    }
}
