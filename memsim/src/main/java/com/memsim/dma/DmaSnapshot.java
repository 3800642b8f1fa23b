package com.memsim.dma;

import java.time.Instant;

/** Immutable view of the DMA state at one point in time. */
public final class DmaSnapshot {
    private final boolean running;
    private final boolean completed;
    private final long source;
    private final long destination;
    private final int length;
    private final int bytesTransferred;
    private final Instant startedAt; // null before the first transfer
    private final Instant finishedAt; // null while running
    private final String message;

    public DmaSnapshot(boolean running, boolean completed, long source, long destination, int length,
            int bytesTransferred, Instant startedAt, Instant finishedAt, String message) {
        this.running = running;
        this.completed = completed;
        this.source = source;
        this.destination = destination;
        this.length = length;
        this.bytesTransferred = bytesTransferred;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.message = message == null ? "" : message;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCompleted() {
        return completed;
    }

    public long getSource() {
        return source;
    }

    public long getDestination() {
        return destination;
    }

    public int getLength() {
        return length;
    }

    public int getBytesTransferred() {
        return bytesTransferred;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return String.format("DMA[%s] 0x%X -> 0x%X %d/%d byte(s): %s",
                running ? "running" : completed ? "done" : "idle", source, destination, bytesTransferred, length,
                message);
    }
}
