package com.memsim.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for memsim.ini style files: one key=value per line, '#' comments,
 * blank and malformed lines ignored. Keys are case-insensitive (stored lower
 * case) and keep their file order.
 */
public class IniFile {

    private final Map<String, String> options = new LinkedHashMap<>();
    private String source = "<empty>";

    public String getOption(String key) {
        if (key == null)
            return null;
        return options.get(key.toLowerCase(Locale.ROOT));
    }

    public boolean hasOption(String key) {
        if (key == null)
            return false;
        return options.containsKey(key.toLowerCase(Locale.ROOT));
    }

    public void setOption(String key, String value) {
        options.put(key.toLowerCase(Locale.ROOT), value);
    }

    /** Keys starting with prefix, in file order. */
    public List<String> keysWithPrefix(String prefix) {
        String p = prefix.toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        for (String k : options.keySet()) {
            if (k.startsWith(p))
                out.add(k);
        }
        return out;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(options);
    }

    /** Where the values came from (file path, classpath resource or text). */
    public String getSource() {
        return source;
    }

    /**
     * Load from a file (missing file gives an empty config).
     */
    public static IniFile load(Path path) throws IOException {
        if (!Files.exists(path))
            return new IniFile();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            IniFile ini = parse(br);
            ini.source = path.toString();
            return ini;
        }
    }

    public static IniFile load(InputStream in, String sourceName) throws IOException {
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            IniFile ini = parse(r);
            ini.source = sourceName;
            return ini;
        }
    }

    public static IniFile fromString(String text) {
        try {
            IniFile ini = parse(new StringReader(text));
            ini.source = "<inline>";
            return ini;
        } catch (IOException ex) {
            // StringReader never fails
            throw new IllegalStateException(ex);
        }
    }

    private static IniFile parse(Reader reader) throws IOException {
        IniFile cfg = new IniFile();
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";"))
                continue;
            int eq = line.indexOf('=');
            if (eq <= 0)
                continue; // ignore malformed
            String key = line.substring(0, eq).trim();
            String val = line.substring(eq + 1).trim();
            int hash = val.indexOf(" #");
            if (hash >= 0)
                val = val.substring(0, hash).trim();
            cfg.options.put(key.toLowerCase(Locale.ROOT), val);
        }
        return cfg;
    }
}
