package com.memsim;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;

import com.memsim.config.AppOptions;
import com.memsim.config.CLIOptionsParser;
import com.memsim.config.ConfigUtils;
import com.memsim.config.IniFile;
import com.memsim.config.MemoryConfig;
import com.memsim.headless.TraceRunner;
import com.memsim.memory.InvalidConfigurationException;
import com.memsim.system.MemorySystem;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Command line entry point: loads memsim.ini, applies CLI overrides, builds
 * the memory system and runs a trace (file or stdin).
 */
public class Main {

    public static void main(String[] args) throws IOException {
        System.exit(run(args));
    }

    /** @return process exit code (0 ok, 1 faults seen, 2 bad configuration) */
    static int run(String[] args) throws IOException {
        AppOptions options = CLIOptionsParser.parse(args);
        if (options.help) {
            System.out.println(CLIOptionsParser.usage());
            return 0;
        }

        MemoryConfig config;
        try {
            IniFile ini = ConfigUtils.loadIni(options.configPath);
            options.checkOptionsFromIni(ini);
            configureLogging(options);
            config = MemoryConfig.fromIni(ini);
            options.applyTo(config);
            config.validate();
        } catch (InvalidConfigurationException ex) {
            Log.error(CONFIG, "Invalid configuration: %s", ex.getMessage());
            return 2;
        }

        try (MemorySystem system = new MemorySystem(config)) {
            if (options.stats) {
                System.out.println(config);
                for (String r : system.getRegions().describeRegions())
                    System.out.println("  " + r);
            }
            TraceRunner runner = new TraceRunner(system, System.out);
            if (options.tracePath != null) {
                Path trace = Path.of(options.tracePath);
                if (!Files.exists(trace)) {
                    Log.error(TRACE, "Trace file not found: %s", trace);
                    return 2;
                }
                try (BufferedReader in = Files.newBufferedReader(trace, StandardCharsets.UTF_8)) {
                    runner.run(in);
                }
            } else {
                Log.info(TRACE, "Reading commands from stdin (R/W/X addr, REFRESH, STATS, DUMP addr len, EXIT)");
                runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            }
            return runner.getFaults() > 0 ? 1 : 0;
        }
    }

    static void configureLogging(AppOptions options) {
        if (options.logLevelOpt != null) {
            Log.Level lvl = Log.parseLevel(options.logLevelOpt);
            if (lvl != null)
                Log.setLevel(lvl);
            else
                Log.warn(GENERAL, "Invalid log level: %s (TRACE|DEBUG|INFO|WARN|ERROR|OFF)", options.logLevelOpt);
        }
        if (options.logCatsOpt != null) {
            if (options.logCatsOpt.equalsIgnoreCase("ALL")) {
                Log.setCategories(EnumSet.allOf(Log.Cat.class));
            } else {
                EnumSet<Log.Cat> set = EnumSet.noneOf(Log.Cat.class);
                for (String c : options.logCatsOpt.split(",")) {
                    c = c.trim();
                    if (c.isEmpty())
                        continue;
                    try {
                        set.add(Log.Cat.valueOf(c.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException ex) {
                        Log.warn(GENERAL, "Unknown log category ignored: %s", c);
                    }
                }
                if (set.isEmpty())
                    Log.warn(GENERAL, "No valid category in --log-cats, keeping defaults");
                else
                    Log.setCategories(set);
            }
        }
        if (options.logTimestamps)
            Log.setTimestamps(true);
    }
}
