package com.memsim.system;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.memsim.config.IniFile;
import com.memsim.config.MemoryConfig;
import com.memsim.memory.InvalidConfigurationException;
import com.memsim.memory.RegionViolationException;

public class MemorySystemTest {

    private MemorySystem system;

    static MemoryConfig testConfig() throws Exception {
        try (InputStream in = MemorySystemTest.class.getClassLoader().getResourceAsStream("test-system.ini")) {
            return MemoryConfig.fromIni(IniFile.load(in, "test-system.ini"));
        }
    }

    @BeforeEach
    public void setUp() throws Exception {
        system = new MemorySystem(testConfig());
    }

    @AfterEach
    public void tearDown() {
        system.close();
    }

    @Test
    public void wiresEveryComponent() {
        assertEquals(16 * 1024, system.getController().getPhysicalSize());
        assertEquals(4, system.getRegions().getRegions().size());
        assertNotNull(system.getCache());
        assertSame(system.getCache(), system.getBus().getCache());
        assertNotNull(system.getDevice());
        assertTrue(system.getController().isMmio(0x3800));
        assertEquals(0, system.getDma().getDelayMs());
    }

    @Test
    public void busEnforcesConfiguredRegions() {
        system.getBus().write(0x1000, 0x5A);
        assertEquals(0x5A, system.getBus().read(0x1000));
        assertThrows(RegionViolationException.class, () -> system.getBus().write(0x3000, 1));
        assertEquals(2, system.getCacheStats().getAccesses());
    }

    @Test
    public void dmaIntoDevice() throws Exception {
        system.getBus().writeBytes(0x1000, new byte[] { 1, 2, 3 });
        system.getDma().transfer(0x1000, 0x3800, 3).get(5, TimeUnit.SECONDS);
        assertEquals(3, system.getDevice().getBytesReceived());
        assertEquals(3, system.getBus().read(0x3802));
    }

    @Test
    public void resetReturnsToPowerOn() {
        system.getBus().write(0x1000, 9);
        system.reset();
        assertEquals(0, system.getController().getCurrentCycle());
        assertEquals(0, system.getCacheStats().getAccesses());
        assertEquals(0, system.getController().peek(0x1000, 1)[0]);
    }

    @Test
    public void disabledCache() throws Exception {
        MemoryConfig cfg = testConfig();
        cfg.cacheEnabled = false;
        try (MemorySystem plain = new MemorySystem(cfg)) {
            assertNull(plain.getCache());
            assertNull(plain.getCacheStats());
            plain.getBus().write(0x1000, 1);
            assertEquals(1, plain.getBus().read(0x1000));
        }
    }

    @Test
    public void invalidConfigIsRejectedBeforeConstruction() throws Exception {
        MemoryConfig cfg = testConfig();
        cfg.cacheSize = 1000;
        assertThrows(InvalidConfigurationException.class, () -> new MemorySystem(cfg));
    }
}
