package com.scidata.dfe.io;

import com.scidata.dfe.exception.DataflowException;
import org.junit.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testClasspathConfigLoads() {
        EngineConfig config = EngineConfig.load();
        assertEquals(10_000, config.getNodeCapacity());
        assertEquals(4, config.getInboundThreads());
        assertEquals(3, config.getDeliveryMaxAttempts());
        assertEquals("crc32", config.getChecksum());
        assertNotNull(config.getStorageDirectory());
    }

    @Test
    public void testFileOverridesDefaults() throws Exception {
        Path file = Files.createTempFile("dfe-config", ".json");
        Files.writeString(file, "{\"nodeCapacity\": 4, \"checksum\": \"crc32c\", \"unknownKey\": true}");
        EngineConfig config = EngineConfig.load(file);
        assertEquals(4, config.getNodeCapacity());
        assertEquals("crc32c", config.getChecksum());
        assertEquals(EngineConfig.defaults().getRpcTimeoutMillis(), config.getRpcTimeoutMillis());
    }

    @Test(expected = DataflowException.class)
    public void testUnreadableFile() {
        EngineConfig.load(Path.of("does/not/exist.json"));
    }
}
