package com.memsim;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {

    @TempDir
    Path dir;

    private Path copyTestConfig() throws Exception {
        Path ini = dir.resolve("system.ini");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("test-system.ini")) {
            Files.copy(in, ini);
        }
        return ini;
    }

    @Test
    public void helpExitsCleanly() throws Exception {
        assertEquals(0, Main.run(new String[] { "--help" }));
    }

    @Test
    public void missingConfigIsAConfigurationError() throws Exception {
        assertEquals(2, Main.run(new String[] { "--config=" + dir.resolve("nope.ini") }));
    }

    @Test
    public void invalidCacheOverrideIsAConfigurationError() throws Exception {
        Path ini = copyTestConfig();
        assertEquals(2, Main.run(new String[] { "--config=" + ini, "--cache-size=1000" }));
    }

    @Test
    public void missingTraceFile() throws Exception {
        Path ini = copyTestConfig();
        assertEquals(2, Main.run(new String[] { "--config=" + ini, dir.resolve("missing.trace").toString() }));
    }

    @Test
    public void exitCodeReflectsFaults() throws Exception {
        Path ini = copyTestConfig();
        Path clean = dir.resolve("clean.trace");
        Files.writeString(clean, "W 0x1000 1\nR 0x1000\n", StandardCharsets.UTF_8);
        Path faulty = dir.resolve("faulty.trace");
        Files.writeString(faulty, "W 0x3000 1\n", StandardCharsets.UTF_8);

        assertEquals(0, Main.run(new String[] { "--config=" + ini, "--stats", clean.toString() }));
        assertEquals(1, Main.run(new String[] { "--config=" + ini, "--no-cache", faulty.toString() }));
    }
}
