package com.memsim.headless;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

import com.memsim.bus.Bus;
import com.memsim.cache.CacheEngine;
import com.memsim.cache.CacheStats;
import com.memsim.memory.MemoryException;
import com.memsim.memory.ReadResult;
import com.memsim.system.MemorySystem;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Headless trace mode. Reads one command per line and drives the memory
 * system through its bus:
 *
 * <pre>
 * R &lt;addr&gt;            read one byte
 * W &lt;addr&gt; [value]    write one byte (default 0)
 * X &lt;addr&gt;            fetch one byte (needs EXECUTE)
 * REFRESH             refresh every bank
 * STATS               print cache statistics
 * DUMP &lt;addr&gt; &lt;len&gt;   hex dump of stored bytes (no timing)
 * EXIT                stop reading
 * </pre>
 *
 * Addresses and values are hex, with or without 0x; '#' starts a comment.
 * A faulting access is reported and counted, the run goes on.
 */
public class TraceRunner {

    private final MemorySystem system;
    private final Bus bus;
    private final PrintStream out;

    private long commands;
    private long accesses;
    private long faults;
    private long malformed;

    public TraceRunner(MemorySystem system, PrintStream out) {
        this.system = system;
        this.bus = system.getBus();
        this.out = out;
    }

    public long getCommands() {
        return commands;
    }

    public long getAccesses() {
        return accesses;
    }

    public long getFaults() {
        return faults;
    }

    public long getMalformed() {
        return malformed;
    }

    /** Run until EXIT or end of input, then print the summary. */
    public void run(BufferedReader in) throws IOException {
        long start = System.nanoTime();
        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (!execute(line, lineNo))
                break;
        }
        printSummary(start);
    }

    /**
     * Execute a single trace line.
     *
     * @return false when the line asked to stop
     */
    public boolean execute(String rawLine, int lineNo) {
        String line = rawLine;
        int hash = line.indexOf('#');
        if (hash >= 0)
            line = line.substring(0, hash);
        line = line.trim();
        if (line.isEmpty())
            return true;
        String[] tok = line.split("\\s+");
        String cmd = tok[0].toUpperCase(Locale.ROOT);
        commands++;
        try {
            switch (cmd) {
                case "R" -> doRead(tok, lineNo);
                case "W" -> doWrite(tok, lineNo);
                case "X" -> doFetch(tok, lineNo);
                case "REFRESH" -> out.printf(Locale.ROOT, "REFRESH (%d cycles)%n", system.getController().refreshAll());
                case "STATS" -> printStats();
                case "DUMP" -> doDump(tok, lineNo);
                case "EXIT", "QUIT" -> {
                    return false;
                }
                default -> {
                    malformed++;
                    Log.warn(TRACE, "Line %d: unknown command '%s'", lineNo, tok[0]);
                }
            }
        } catch (MemoryException ex) {
            faults++;
            Log.warn(TRACE, "Line %d: %s -> %s: %s", lineNo, line, ex.getClass().getSimpleName(), ex.getMessage());
        } catch (IllegalArgumentException ex) {
            malformed++;
            Log.warn(TRACE, "Line %d: %s", lineNo, ex.getMessage());
        }
        return true;
    }

    private void doRead(String[] tok, int lineNo) {
        long addr = parseHex(arg(tok, 1, lineNo), lineNo);
        long missesBefore = misses();
        accesses++;
        ReadResult r = bus.readBytes(addr, 1);
        out.printf(Locale.ROOT, "R 0x%08X = 0x%02X %s(%d cycles)%n", addr, r.get(0), hitMark(addr, missesBefore),
                r.getCycles());
    }

    private void doWrite(String[] tok, int lineNo) {
        long addr = parseHex(arg(tok, 1, lineNo), lineNo);
        int value = tok.length > 2 ? (int) (parseHex(tok[2], lineNo) & 0xFF) : 0;
        long missesBefore = misses();
        accesses++;
        int cycles = bus.writeBytes(addr, new byte[] { (byte) value });
        out.printf(Locale.ROOT, "W 0x%08X <- 0x%02X %s(%d cycles)%n", addr, value, hitMark(addr, missesBefore),
                cycles);
    }

    private void doFetch(String[] tok, int lineNo) {
        long addr = parseHex(arg(tok, 1, lineNo), lineNo);
        long missesBefore = misses();
        accesses++;
        ReadResult r = bus.fetch(addr, 1);
        out.printf(Locale.ROOT, "X 0x%08X = 0x%02X %s(%d cycles)%n", addr, r.get(0), hitMark(addr, missesBefore),
                r.getCycles());
    }

    private void doDump(String[] tok, int lineNo) {
        long addr = parseHex(arg(tok, 1, lineNo), lineNo);
        int len = (int) parseHex(arg(tok, 2, lineNo), lineNo);
        byte[] data = system.getController().peek(addr, len);
        for (int i = 0; i < data.length; i += 16) {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format(Locale.ROOT, "%08X:", addr + i));
            for (int j = i; j < Math.min(i + 16, data.length); j++)
                sb.append(String.format(Locale.ROOT, " %02X", data[j] & 0xFF));
            out.println(sb);
        }
    }

    private long misses() {
        CacheEngine cache = bus.getCache();
        return cache != null ? cache.getStats().getMisses() : -1;
    }

    /** HIT / MISS tag for a cached access, empty when uncached or MMIO. */
    private String hitMark(long address, long missesBefore) {
        if (missesBefore < 0 || bus.getController().isMmio(address))
            return "";
        return misses() > missesBefore ? "MISS " : "HIT ";
    }

    public void printStats() {
        CacheStats s = system.getCacheStats();
        if (s == null) {
            out.println("Cache: disabled");
            return;
        }
        out.println("Cache: " + s.getConfig());
        out.printf(Locale.ROOT, "  Reads=%d Writes=%d Hits=%d Misses=%d MemoryWrites=%d%n", s.getReads(),
                s.getWrites(), s.getHits(), s.getMisses(), s.getMemoryWrites());
        out.printf(Locale.ROOT, "  HitRate=%.2f%% MissRate=%.2f%%%n", s.getHitRate() * 100, s.getMissRate() * 100);
    }

    private void printSummary(long startNanos) {
        printStats();
        out.printf(Locale.ROOT, "Cycles: %d%n", system.getController().getCurrentCycle());
        double ms = (System.nanoTime() - startNanos) / 1_000_000.0;
        Log.info(TRACE, "Trace done: commands=%d accesses=%d faults=%d malformed=%d (%.1f ms)", commands, accesses,
                faults, malformed, ms);
    }

    private static String arg(String[] tok, int idx, int lineNo) {
        if (tok.length <= idx)
            throw new IllegalArgumentException("Line " + lineNo + ": missing argument for " + tok[0]);
        return tok[idx];
    }

    /** Hex with or without 0x. */
    static long parseHex(String text, int lineNo) {
        String t = text.trim();
        if (t.startsWith("0x") || t.startsWith("0X"))
            t = t.substring(2);
        try {
            return Long.parseLong(t, 16);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Line " + lineNo + ": invalid hex value '" + text + "'", ex);
        }
    }
}
