package com.memsim.memory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import com.memsim.memory.interfaces.PhysicalBus;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * DRAM memory controller.
 *
 * Responsibilities:
 * - Translate physical addresses to (channel, rank, bank, row, column) and
 * drive each bank's row buffer: Closed -> activate (tRCD), Open(r) -> hit
 * (tCL + tBurst), Open(r2) -> precharge (tRP) + activate + access.
 * - Keep the global simulated cycle counter.
 * - Route accesses that start inside a registered MMIO range to the device
 * handler.
 * - Serialize every access behind one fair lock (single-ported DRAM): reads,
 * writes, write-backs, refreshes and the async variants all take it for the
 * state transition and byte transfer.
 * - Notify observers after each access has committed.
 */
public class MemoryController implements PhysicalBus {

    /** Async pacing scale: one cycle = 0.0005 ms. */
    public static final double DEFAULT_CYCLE_TO_MS = 0.0005;

    private final DramGeometry geometry;
    private final DramTiming timing;
    private final DramBank[] banks; // flattened [channel][rank][bank]
    private final AtomicLong cycleCounter = new AtomicLong();
    private final ReentrantLock memLock = new ReentrantLock(true);

    private final List<MmioRange> mmio = new CopyOnWriteArrayList<>();
    private final List<MemoryObserver> observers = new CopyOnWriteArrayList<>();

    private volatile double cycleToMillis;

    public MemoryController(DramGeometry geometry, DramTiming timing) {
        this(geometry, timing, DEFAULT_CYCLE_TO_MS);
    }

    public MemoryController(DramGeometry geometry, DramTiming timing, double cycleToMillis) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.timing = timing != null ? timing : DramTiming.defaults();
        setCycleToMillis(cycleToMillis);
        this.banks = new DramBank[geometry.getTotalBanks()];
        for (int i = 0; i < banks.length; i++)
            banks[i] = new DramBank(geometry.getRowsPerBank(), geometry.getColsPerRow());
        Log.debug(DRAM, "Controller created: %s | %s | size=0x%X", geometry, this.timing,
                geometry.getPhysicalSize());
    }

    // --- configuration / introspection ---

    public DramGeometry getGeometry() {
        return geometry;
    }

    public DramTiming getTiming() {
        return timing;
    }

    public long getPhysicalSize() {
        return geometry.getPhysicalSize();
    }

    public long getCurrentCycle() {
        return cycleCounter.get();
    }

    public double getCycleToMillis() {
        return cycleToMillis;
    }

    public void setCycleToMillis(double cycleToMillis) {
        if (cycleToMillis < 0 || Double.isNaN(cycleToMillis))
            throw new InvalidConfigurationException("cycle-to-ms scale must be >= 0 (got " + cycleToMillis + ")");
        this.cycleToMillis = cycleToMillis;
    }

    public String getTopologyInfo() {
        return geometry.toString();
    }

    public ControllerSnapshot snapshot() {
        memLock.lock();
        try {
            int[] open = new int[banks.length];
            for (int i = 0; i < banks.length; i++)
                open[i] = banks[i].getOpenRow();
            return new ControllerSnapshot(getTopologyInfo(), cycleCounter.get(), open);
        } finally {
            memLock.unlock();
        }
    }

    /** Open row of one bank, {@link DramBank#NO_OPEN_ROW} when closed. */
    public int getOpenRow(int channel, int rank, int bank) {
        memLock.lock();
        try {
            return banks[bankIndex(channel, rank, bank)].getOpenRow();
        } finally {
            memLock.unlock();
        }
    }

    public void addObserver(MemoryObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public void removeObserver(MemoryObserver observer) {
        observers.remove(observer);
    }

    // --- MMIO ---

    /**
     * Route [start, start + size) to a device. Ranges must lie inside the
     * physical space and must not overlap each other.
     */
    public void registerMmioHandler(long start, long size, MmioHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (size <= 0 || !fitsPhysical(start, size))
            throw new OutOfBoundsException(start, (int) Math.min(size, Integer.MAX_VALUE), String.format(
                    "MMIO range 0x%X+0x%X outside physical space (size=0x%X)", start, size,
                    geometry.getPhysicalSize()));
        synchronized (mmio) {
            for (MmioRange r : mmio) {
                if (r.overlaps(start, size))
                    throw new RegionOverlapException(String.format(
                            "MMIO range 0x%X+0x%X overlaps 0x%X+0x%X", start, size, r.start, r.size));
            }
            mmio.add(new MmioRange(start, size, handler));
        }
        Log.debug(MMIO, "MMIO handler registered at 0x%X (size=0x%X)", start, size);
    }

    /** True if the address belongs to a registered MMIO range. */
    public boolean isMmio(long address) {
        return findMmio(address) != null;
    }

    private MmioRange findMmio(long address) {
        for (MmioRange r : mmio) {
            if (r.contains(address))
                return r;
        }
        return null;
    }

    // --- bounds ---

    /**
     * Validate an access without touching any state. MMIO accesses must stay
     * inside their device range; DRAM accesses must fit in the physical space
     * and inside one row at the decoded column.
     */
    public void checkBounds(long address, int length) {
        if (length < 0)
            throw new OutOfBoundsException(address, length, "Negative length " + length);
        if (length == 0)
            return;
        if (!fitsPhysical(address, length))
            throw new OutOfBoundsException(address, length, String.format(
                    "Access 0x%X+%d outside physical space (size=0x%X)", address, length,
                    geometry.getPhysicalSize()));
        MmioRange r = findMmio(address);
        if (r != null) {
            if (address - r.start > r.size - length)
                throw new OutOfBoundsException(address, length, String.format(
                        "Access 0x%X+%d runs past MMIO range end 0x%X", address, length, r.start + r.size));
            return;
        }
        for (MmioRange m : mmio) {
            if (m.overlaps(address, length))
                throw new OutOfBoundsException(address, length, String.format(
                        "DRAM access 0x%X+%d runs into MMIO range 0x%X+0x%X", address, length, m.start, m.size));
        }
        int col = (int) (address % geometry.getColsPerRow());
        if ((long) col + length > geometry.getColsPerRow())
            throw new OutOfBoundsException(address, length, String.format(
                    "Access 0x%X+%d crosses row boundary (col=%d, cols=%d)", address, length, col,
                    geometry.getColsPerRow()));
    }

    /** [address, address + length) inside the physical space, without overflowing. */
    private boolean fitsPhysical(long address, long length) {
        return address >= 0 && length >= 0 && address <= geometry.getPhysicalSize() - length;
    }

    private static int deviceCost(MmioRange r, long address, int cycles) {
        if (cycles < 0)
            throw new IllegalStateException(String.format(
                    "MMIO handler at 0x%X reported a negative cost (%d cycles) for 0x%X", r.start, cycles, address));
        return cycles;
    }

    // --- synchronous access ---

    @Override
    public ReadResult readBytes(long address, int length) {
        checkBounds(address, length);
        if (length == 0)
            return ReadResult.EMPTY;
        ReadResult result;
        RowHit hit = null;
        memLock.lock();
        try {
            MmioRange r = findMmio(address);
            if (r != null) {
                ReadResult dev = r.handler.read(address, length);
                cycleCounter.addAndGet(deviceCost(r, address, dev.getCycles()));
                result = dev;
            } else {
                DramAddress d = AddressCodec.decodeDram(address, geometry);
                DramBank bank = banks[bankIndex(d)];
                boolean rowHit = bank.getOpenRow() == d.getRow();
                int cycles = openRow(bank, d.getRow());
                byte[] data = bank.readOpenRow(d.getColumn(), length);
                cycleCounter.addAndGet(cycles);
                result = new ReadResult(data, cycles);
                if (rowHit)
                    hit = new RowHit(d);
            }
        } finally {
            memLock.unlock();
        }
        if (hit != null)
            fireRowHit(hit);
        fire(o -> o.onRead(address, length));
        return result;
    }

    @Override
    public int writeBytes(long address, byte[] data) {
        if (data == null || data.length == 0)
            return 0;
        checkBounds(address, data.length);
        byte[] copy = data.clone();
        int cycles;
        RowHit hit = null;
        memLock.lock();
        try {
            MmioRange r = findMmio(address);
            if (r != null) {
                cycles = deviceCost(r, address, r.handler.write(address, copy));
                cycleCounter.addAndGet(cycles);
            } else {
                DramAddress d = AddressCodec.decodeDram(address, geometry);
                DramBank bank = banks[bankIndex(d)];
                boolean rowHit = bank.getOpenRow() == d.getRow();
                cycles = openRow(bank, d.getRow());
                bank.writeOpenRow(d.getColumn(), copy);
                cycleCounter.addAndGet(cycles);
                if (rowHit)
                    hit = new RowHit(d);
            }
        } finally {
            memLock.unlock();
        }
        if (hit != null)
            fireRowHit(hit);
        fire(o -> o.onWrite(address, copy.length));
        return cycles;
    }

    /**
     * Write-back of a cache block: charges the row-buffer transition and the
     * column access for the block starting at blockAddress. The cache only
     * tracks metadata, DRAM already holds the bytes, so no byte changes.
     *
     * @return cycle cost
     */
    public int writeBack(long blockAddress, int blockSize) {
        if (blockSize <= 0)
            return 0;
        if (blockAddress < 0 || blockAddress >= geometry.getPhysicalSize())
            throw new OutOfBoundsException(blockAddress, blockSize, String.format(
                    "Write-back block 0x%X outside physical space (size=0x%X)", blockAddress,
                    geometry.getPhysicalSize()));
        int cycles;
        RowHit hit = null;
        memLock.lock();
        try {
            DramAddress d = AddressCodec.decodeDram(blockAddress, geometry);
            DramBank bank = banks[bankIndex(d)];
            boolean rowHit = bank.getOpenRow() == d.getRow();
            cycles = openRow(bank, d.getRow());
            cycleCounter.addAndGet(cycles);
            if (rowHit)
                hit = new RowHit(d);
        } finally {
            memLock.unlock();
        }
        if (hit != null)
            fireRowHit(hit);
        fire(o -> o.onWrite(blockAddress, blockSize));
        return cycles;
    }

    /**
     * Broadcast refresh: every bank ends closed; costs tRFC once regardless of
     * bank count.
     */
    public int refreshAll() {
        int cost = timing.getRefreshCycleTime();
        memLock.lock();
        try {
            for (DramBank b : banks)
                b.precharge();
            cycleCounter.addAndGet(cost);
        } finally {
            memLock.unlock();
        }
        fire(MemoryObserver::onRefreshStarted);
        return cost;
    }

    /**
     * Copy-out of stored DRAM bytes, may span rows. Touches no row buffer,
     * cycle counter or observer.
     */
    public byte[] peek(long address, int length) {
        if (!fitsPhysical(address, length))
            throw new OutOfBoundsException(address, length, String.format(
                    "Peek 0x%X+%d outside physical space (size=0x%X)", address, length,
                    geometry.getPhysicalSize()));
        byte[] out = new byte[length];
        memLock.lock();
        try {
            int done = 0;
            while (done < length) {
                DramAddress d = AddressCodec.decodeDram(address + done, geometry);
                int chunk = Math.min(length - done, geometry.getColsPerRow() - d.getColumn());
                byte[] part = banks[bankIndex(d)].peek(d.getRow(), d.getColumn(), chunk);
                System.arraycopy(part, 0, out, done, chunk);
                done += chunk;
            }
        } finally {
            memLock.unlock();
        }
        return out;
    }

    /** Reinitialize: close all banks, zero storage and the cycle counter. */
    public void reset() {
        memLock.lock();
        try {
            for (DramBank b : banks)
                b.clear();
            cycleCounter.set(0);
        } finally {
            memLock.unlock();
        }
    }

    // --- asynchronous access ---

    @Override
    public CompletableFuture<ReadResult> readBytesAsync(long address, int length) {
        ReadResult r = readBytes(address, length);
        return pace(r, r.getCycles());
    }

    @Override
    public CompletableFuture<Integer> writeBytesAsync(long address, byte[] data) {
        int cycles = writeBytes(address, data);
        return pace(cycles, cycles);
    }

    /**
     * Deliver an already committed result after ceil(cycles * scale) ms.
     */
    public <T> CompletableFuture<T> pace(T result, int cycles) {
        long delayMs = (long) Math.ceil(cycles * cycleToMillis);
        if (delayMs <= 0)
            return CompletableFuture.completedFuture(result);
        Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> result, delayed);
    }

    // --- internals ---

    /** Row-buffer state machine; returns the cost of reaching the row plus the column access. */
    private int openRow(DramBank bank, int row) {
        if (bank.getOpenRow() == row)
            return timing.columnAccessCost();
        int cycles = 0;
        if (bank.hasOpenRow()) {
            cycles += timing.getRowPrechargeTime();
            bank.precharge();
        }
        cycles += timing.getRasToCasDelay();
        bank.activate(row);
        return cycles + timing.columnAccessCost();
    }

    private int bankIndex(DramAddress d) {
        return bankIndex(d.getChannel(), d.getRank(), d.getBank());
    }

    private int bankIndex(int channel, int rank, int bank) {
        if (channel < 0 || channel >= geometry.getChannels() || rank < 0 || rank >= geometry.getRanksPerChannel()
                || bank < 0 || bank >= geometry.getBanksPerRank())
            throw new OutOfBoundsException(-1, 0,
                    String.format("No bank ch=%d rk=%d bk=%d in %s", channel, rank, bank, geometry));
        return (channel * geometry.getRanksPerChannel() + rank) * geometry.getBanksPerRank() + bank;
    }

    private void fireRowHit(RowHit h) {
        fire(o -> o.onRowBufferHit(h.channel, h.rank, h.bank, h.row));
    }

    private void fire(Consumer<MemoryObserver> event) {
        for (MemoryObserver o : observers) {
            try {
                event.accept(o);
            } catch (RuntimeException ex) {
                Log.warn(DRAM, "Observer %s failed: %s", o.getClass().getSimpleName(), ex.toString());
            }
        }
    }

    private static final class RowHit {
        final int channel, rank, bank, row;

        RowHit(DramAddress d) {
            this.channel = d.getChannel();
            this.rank = d.getRank();
            this.bank = d.getBank();
            this.row = d.getRow();
        }
    }

    private static final class MmioRange {
        final long start;
        final long size;
        final MmioHandler handler;

        MmioRange(long start, long size, MmioHandler handler) {
            this.start = start;
            this.size = size;
            this.handler = handler;
        }

        boolean contains(long address) {
            return address >= start && address < start + size;
        }

        boolean overlaps(long otherStart, long otherSize) {
            return otherStart < start + size && start < otherStart + otherSize;
        }
    }
}
