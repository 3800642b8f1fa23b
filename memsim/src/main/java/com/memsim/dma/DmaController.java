package com.memsim.dma;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.memsim.bus.interfaces.SystemBus;
import com.memsim.memory.MemoryException;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Single-channel DMA engine.
 *
 * Copies bytes one at a time through the same {@link SystemBus} the CPU uses,
 * so permissions, cache accounting, MMIO routing and DRAM timing all apply.
 * Transfers run on a dedicated worker thread with a fixed pause between bytes;
 * only one transfer may be in flight.
 */
public class DmaController implements AutoCloseable {

    private final SystemBus bus;
    private final long delayMs;
    private final DmaState state = new DmaState();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "dma-worker");
        t.setDaemon(true);
        return t;
    });

    public DmaController(SystemBus bus) {
        this(bus, 0);
    }

    public DmaController(SystemBus bus, long delayMs) {
        this.bus = Objects.requireNonNull(bus, "bus");
        if (delayMs < 0)
            throw new IllegalArgumentException("DMA delay must be >= 0 ms (got " + delayMs + ")");
        this.delayMs = delayMs;
    }

    public long getDelayMs() {
        return delayMs;
    }

    public boolean isBusy() {
        return state.isRunning();
    }

    public DmaSnapshot getStateSnapshot() {
        return state.getSnapshot();
    }

    /**
     * Start copying length bytes from source to destination.
     *
     * @return future completing when the last byte is written, or exceptionally
     *         with the fault that stopped the copy (bytes already moved stay
     *         moved)
     * @throws IllegalStateException if a transfer is already running
     */
    public CompletableFuture<Void> transfer(long source, long destination, int length) {
        if (length < 0)
            throw new IllegalArgumentException("Negative DMA length " + length);
        if (!state.tryStart(source, destination, length))
            throw new IllegalStateException("A DMA transfer is already running");
        Log.debug(DMA, "Transfer 0x%X -> 0x%X (%d bytes) started", source, destination, length);
        try {
            return CompletableFuture.runAsync(() -> copy(source, destination, length), worker);
        } catch (RejectedExecutionException ex) {
            state.fail("DMA controller closed");
            throw new IllegalStateException("DMA controller closed", ex);
        }
    }

    private void copy(long source, long destination, int length) {
        int moved = 0;
        try {
            for (int i = 0; i < length; i++) {
                int value = bus.read(source + i);
                bus.write(destination + i, value);
                moved = i + 1;
                state.reportProgress(moved);
                if (delayMs > 0 && moved < length)
                    Thread.sleep(delayMs);
            }
        } catch (MemoryException ex) {
            state.fail("Transfer failed after " + moved + " byte(s): " + ex.getMessage());
            Log.warn(DMA, "Transfer 0x%X -> 0x%X aborted at byte %d: %s", source, destination, moved,
                    ex.getMessage());
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            state.fail("Transfer interrupted after " + moved + " byte(s)");
            throw new IllegalStateException("DMA transfer interrupted", ex);
        }
        state.complete();
        Log.debug(DMA, "Transfer 0x%X -> 0x%X completed (%d bytes)", source, destination, length);
    }

    /** Stop the worker; a running transfer is interrupted. */
    @Override
    public void close() {
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(1, TimeUnit.SECONDS))
                Log.warn(DMA, "DMA worker did not stop within 1s");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
