package com.scidata.dfe.storage;

import com.scidata.dfe.api.ChecksumFactory;

import java.util.zip.CRC32;
import java.util.zip.CRC32C;
import java.util.zip.Checksum;

/**
 * Stock checksum algorithms for node derived values.
 */
public final class Checksums {
    public static final ChecksumFactory CRC_32 = CRC32::new;
    public static final ChecksumFactory CRC_32C = CRC32C::new;

    private Checksums() {
        // Utility class
    }

    /** Resolves a checksum by configuration name ("crc32" or "crc32c"). */
    public static ChecksumFactory byName(String name) {
        if (name == null)
            return CRC_32;
        return switch (name.toLowerCase()) {
            case "crc32" -> CRC_32;
            case "crc32c" -> CRC_32C;
            default -> throw new IllegalArgumentException("Unknown checksum: " + name);
        };
    }

    /** One-shot CRC-32 of a whole buffer. */
    public static long crc32(byte[] data) {
        Checksum c = CRC_32.newChecksum();
        c.update(data, 0, data.length);
        return c.getValue();
    }
}
