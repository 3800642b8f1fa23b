package com.memsim.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.memsim.memory.InvalidConfigurationException;
import com.memsim.util.Log;
import static com.memsim.util.Log.Cat.*;

/**
 * Helpers for loading memsim.ini and parsing the number formats it uses.
 */
public final class ConfigUtils {
    public static final String DEFAULT_INI = "memsim.ini";

    private ConfigUtils() {
    }

    /**
     * Load the INI: explicit path if given, else memsim.ini in the working
     * directory, else the bundled classpath copy, else an empty config.
     *
     * @throws InvalidConfigurationException if an explicit path is missing or
     *                                       unreadable
     */
    public static IniFile loadIni(String explicitPath) {
        if (explicitPath != null) {
            Path p = Path.of(explicitPath);
            if (!Files.exists(p))
                throw new InvalidConfigurationException("Config file not found: " + explicitPath);
            try {
                return IniFile.load(p);
            } catch (IOException ex) {
                throw new InvalidConfigurationException("Cannot read config " + explicitPath + ": " + ex.getMessage(),
                        ex);
            }
        }
        Path cwd = Path.of(DEFAULT_INI);
        try {
            if (Files.exists(cwd))
                return IniFile.load(cwd);
            try (InputStream in = ConfigUtils.class.getClassLoader().getResourceAsStream(DEFAULT_INI)) {
                if (in != null)
                    return IniFile.load(in, "classpath:" + DEFAULT_INI);
            }
        } catch (IOException ex) {
            Log.warn(CONFIG, "Failed to read %s: %s (using defaults)", DEFAULT_INI, ex.getMessage());
        }
        return new IniFile();
    }

    /** Decimal, or hex with a 0x prefix. */
    public static long parseLong(String text, String what) {
        if (text == null || text.isBlank())
            throw new InvalidConfigurationException("Missing value for " + what);
        String t = text.trim().replace("_", "");
        try {
            if (t.startsWith("0x") || t.startsWith("0X"))
                return Long.parseLong(t.substring(2), 16);
            return Long.parseLong(t);
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Invalid number for " + what + ": \"" + text + "\"", ex);
        }
    }

    public static int parseInt(String text, String what) {
        long v = parseLong(text, what);
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE)
            throw new InvalidConfigurationException("Value for " + what + " out of range: " + text);
        return (int) v;
    }

    /** Byte count with optional B/KB/MB/GB suffix (binary multiples). */
    public static long parseSize(String text, String what) {
        if (text == null || text.isBlank())
            throw new InvalidConfigurationException("Missing value for " + what);
        String t = text.trim().toUpperCase(Locale.ROOT);
        long mult = 1;
        int cut = 0;
        if (t.endsWith("KB") || t.endsWith("MB") || t.endsWith("GB")) {
            cut = 2;
        } else if (t.endsWith("K") || t.endsWith("M") || t.endsWith("G")) {
            cut = 1;
        } else if (t.endsWith("B") && !t.startsWith("0X")) {
            cut = 1; // plain bytes, "64B"
        }
        if (cut > 0 && t.length() > cut) {
            char unit = t.charAt(t.length() - cut);
            if (unit == 'K')
                mult = 1024L;
            else if (unit == 'M')
                mult = 1024L * 1024;
            else if (unit == 'G')
                mult = 1024L * 1024 * 1024;
            t = t.substring(0, t.length() - cut).trim();
        }
        return Math.multiplyExact(parseLong(t, what), mult);
    }

    public static int parseIntSize(String text, String what) {
        long v = parseSize(text, what);
        if (v > Integer.MAX_VALUE)
            throw new InvalidConfigurationException("Value for " + what + " too large: " + text);
        return (int) v;
    }

    public static double parseDouble(String text, String what) {
        if (text == null || text.isBlank())
            throw new InvalidConfigurationException("Missing value for " + what);
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Invalid number for " + what + ": \"" + text + "\"", ex);
        }
    }

    /** true|1|yes|on / false|0|no|off. */
    public static boolean parseBoolean(String text, String what) {
        String v = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1") || v.equals("yes") || v.equals("on"))
            return true;
        if (v.equals("false") || v.equals("0") || v.equals("no") || v.equals("off"))
            return false;
        throw new InvalidConfigurationException("Invalid boolean for " + what + ": \"" + text + "\" (true|false)");
    }
}
