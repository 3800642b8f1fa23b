package com.memsim.config;

import com.memsim.cache.ReplacementPolicy;
import com.memsim.cache.WritePolicy;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Holder for application options parsed from the CLI.
 *
 * Notes on sources and precedence:
 * - CLI values go here (filled by CLIOptionsParser).
 * - memsim.ini is loaded into a {@link MemoryConfig} first; {@link #applyTo}
 * then overrides only what the CLI specified (null / false = not given).
 * - Logging options have an INI fallback (log-level, log-cats, log-ts).
 */
public class AppOptions {

    /** INI path. CLI: --config=PATH. Default: memsim.ini lookup. */
    public String configPath = null;

    /** Trace file to run. CLI: --trace=PATH or positional. Default: stdin. */
    public String tracePath = null;

    /** Global log level name. CLI: --log-level=LEVEL. */
    public String logLevelOpt = null;

    /** Comma separated categories or ALL. CLI: --log-cats=A,B. */
    public String logCatsOpt = null;

    /** Prefix log lines with a time stamp. CLI: --timestamps. */
    public boolean logTimestamps = false;

    /** Cache size in bytes. CLI: --cache-size=N (KB/MB suffix allowed). */
    public Integer cacheSize = null;

    /** Block size in bytes. CLI: --cache-block=N. */
    public Integer cacheBlock = null;

    /** Ways per set, 0 = fully associative. CLI: --cache-assoc=N. */
    public Integer cacheAssoc = null;

    /** CLI: --replacement=LRU|FIFO. */
    public ReplacementPolicy replacement = null;

    /** CLI: --write-policy=WB|WT. */
    public WritePolicy writePolicy = null;

    /** Run without a cache. CLI: --no-cache. */
    public boolean noCache = false;

    /** Print cache stats and the region map before the run. CLI: --stats. */
    public boolean stats = false;

    /** CLI: --help / -h. */
    public boolean help = false;

    /** Override config values the CLI specified. */
    public void applyTo(MemoryConfig cfg) {
        if (cacheSize != null)
            cfg.cacheSize = cacheSize;
        if (cacheBlock != null)
            cfg.cacheBlock = cacheBlock;
        if (cacheAssoc != null)
            cfg.cacheAssoc = cacheAssoc;
        if (replacement != null)
            cfg.replacement = replacement;
        if (writePolicy != null)
            cfg.writePolicy = writePolicy;
        if (noCache)
            cfg.cacheEnabled = false;
    }

    /** Fill logging options the CLI left unset from the INI. */
    public void checkOptionsFromIni(IniFile ini) {
        if (ini == null)
            return;
        if (logLevelOpt == null && ini.hasOption("log-level"))
            logLevelOpt = ini.getOption("log-level");
        if (logCatsOpt == null && ini.hasOption("log-cats"))
            logCatsOpt = ini.getOption("log-cats");
        if (!logTimestamps && ini.hasOption("log-ts")) {
            try {
                logTimestamps = ConfigUtils.parseBoolean(ini.getOption("log-ts"), "log-ts");
            } catch (RuntimeException ex) {
                Log.warn(CONFIG, "Ignoring log-ts: %s", ex.getMessage());
            }
        }
        if (tracePath == null && ini.hasOption("trace"))
            tracePath = ini.getOption("trace");
    }
}
