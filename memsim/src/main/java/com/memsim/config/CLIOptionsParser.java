package com.memsim.config;

import java.util.Locale;

import com.memsim.cache.ReplacementPolicy;
import com.memsim.cache.WritePolicy;
import com.memsim.memory.InvalidConfigurationException;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/** Parses CLI arguments into an AppOptions struct. */
public final class CLIOptionsParser {

    private CLIOptionsParser() {
    }

    /**
     * Parses CLI args. Unknown flags and malformed values are reported with a
     * warning and skipped.
     */
    public static AppOptions parse(String[] args) {
        AppOptions o = new AppOptions();
        if (args == null)
            return o;
        for (String a : args) {
            if (a == null || a.isBlank())
                continue;
            try {
                parseOne(o, a.trim());
            } catch (InvalidConfigurationException ex) {
                Log.warn(CONFIG, "Ignoring %s: %s", a, ex.getMessage());
            }
        }
        return o;
    }

    private static void parseOne(AppOptions o, String a) {
        if (a.equalsIgnoreCase("--help") || a.equals("-h")) {
            o.help = true;
        } else if (a.startsWith("--config=")) {
            o.configPath = value(a);
        } else if (a.startsWith("--trace=")) {
            o.tracePath = value(a);
        } else if (a.startsWith("--log-level=")) {
            o.logLevelOpt = value(a);
        } else if (a.startsWith("--log-cats=")) {
            o.logCatsOpt = value(a);
        } else if (a.equalsIgnoreCase("--timestamps") || a.equalsIgnoreCase("--log-ts")) {
            o.logTimestamps = true;
        } else if (a.startsWith("--cache-size=")) {
            o.cacheSize = ConfigUtils.parseIntSize(value(a), "--cache-size");
        } else if (a.startsWith("--cache-block=")) {
            o.cacheBlock = ConfigUtils.parseIntSize(value(a), "--cache-block");
        } else if (a.startsWith("--cache-assoc=")) {
            o.cacheAssoc = ConfigUtils.parseInt(value(a), "--cache-assoc");
        } else if (a.startsWith("--replacement=")) {
            o.replacement = ReplacementPolicy.parse(value(a));
        } else if (a.startsWith("--write-policy=")) {
            o.writePolicy = WritePolicy.parse(value(a));
        } else if (a.equalsIgnoreCase("--no-cache")) {
            o.noCache = true;
        } else if (a.equalsIgnoreCase("--stats")) {
            o.stats = true;
        } else if (a.startsWith("--")) {
            Log.warn(CONFIG, "Unknown option: %s", a);
        } else if (o.tracePath == null) {
            o.tracePath = a; // positional trace file
        } else {
            Log.warn(CONFIG, "Extra argument ignored: %s", a);
        }
    }

    private static String value(String arg) {
        String v = arg.substring(arg.indexOf('=') + 1).trim();
        if (v.isEmpty())
            throw new InvalidConfigurationException("empty value");
        return v;
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: memsim [options] [trace-file]",
                "  --config=PATH          INI file (default: ./memsim.ini, then bundled)",
                "  --trace=PATH           trace file (default: stdin)",
                "  --log-level=LEVEL      TRACE|DEBUG|INFO|WARN|ERROR|OFF",
                "  --log-cats=A,B|ALL     " + String.join(",", catNames()),
                "  --timestamps           prefix log lines with a time stamp",
                "  --cache-size=N         cache size in bytes (KB/MB suffix allowed)",
                "  --cache-block=N        block size in bytes",
                "  --cache-assoc=N        ways per set (0 = fully associative)",
                "  --replacement=LRU|FIFO",
                "  --write-policy=WB|WT",
                "  --no-cache             run without a cache",
                "  --stats                print configuration and regions before the run");
    }

    private static String[] catNames() {
        Log.Cat[] cats = Log.Cat.values();
        String[] out = new String[cats.length];
        for (int i = 0; i < cats.length; i++)
            out[i] = cats[i].name().toLowerCase(Locale.ROOT);
        return out;
    }
}
