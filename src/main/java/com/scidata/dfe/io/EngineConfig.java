package com.scidata.dfe.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidata.dfe.exception.DataflowException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Engine settings. Loaded from {@code dfe-config.json} on the classpath when
 * present; every field has a default.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String RESOURCE = "dfe-config.json";

    /** Maximum live plus reserved nodes per manager. */
    private int nodeCapacity = 10_000;
    /** Attempts per remote event delivery. */
    private int deliveryMaxAttempts = 3;
    /** Base delay between delivery attempts. */
    private long deliveryBackoffMillis = 50;
    /** Connect and socket timeout of manager RPCs. */
    private int rpcTimeoutMillis = 5_000;
    /** Remote dispatcher ring size, a power of two. */
    private int ringBufferSize = 1024;
    /** Threads handling events that arrive from other managers. */
    private int inboundThreads = 4;
    /** Sessions a coordinator admits at once. */
    private int maxConcurrentSessions = 64;
    /** Parent directory of file-backed nodes. */
    private String storageDirectory = System.getProperty("java.io.tmpdir") + "/dfe-storage";
    /** Checksum of node derived values: crc32 or crc32c. */
    private String checksum = "crc32";

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /** Loads the classpath configuration, falling back to defaults. */
    public static EngineConfig load() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            return mapper().readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new DataflowException("Cannot read " + RESOURCE, e);
        }
    }

    public static EngineConfig load(Path path) {
        try {
            return mapper().readValue(Files.readString(path), EngineConfig.class);
        } catch (IOException e) {
            throw new DataflowException("Cannot read engine config " + path, e);
        }
    }

    private static ObjectMapper mapper() {
        return JsonSupport.newMapper();
    }
}
