package com.scidata.dfe.storage;

import com.scidata.dfe.api.DataStorage;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32C;

import static org.junit.Assert.*;

public class StorageTest {

    private static void appendAndRead(DataStorage storage) {
        byte[] data = "hello, storage".getBytes(StandardCharsets.UTF_8);
        storage.append(data, 0, 5);
        storage.append(data, 5, data.length - 5);
        assertEquals(data.length, storage.size());
        assertEquals("hello", new String(storage.read(0, 5), StandardCharsets.UTF_8));
        assertEquals("storage", new String(storage.read(7, 100), StandardCharsets.UTF_8));
        assertEquals(0, storage.read(data.length, 10).length);
    }

    @Test
    public void testInMemoryAppendAndRead() {
        appendAndRead(new InMemoryStorage(16));
    }

    @Test
    public void testInMemoryGrowsPastInitialCapacity() {
        InMemoryStorage s = new InMemoryStorage(16);
        byte[] block = new byte[1000];
        for (int i = 0; i < 10; i++)
            s.append(block, 0, block.length);
        assertEquals(10_000, s.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testInMemoryReleasedStorageRejectsWrites() {
        InMemoryStorage s = new InMemoryStorage();
        s.release();
        s.append(new byte[1], 0, 1);
    }

    @Test
    public void testFileAppendReadAndRelease() throws Exception {
        Path dir = Files.createTempDirectory("dfe-storage");
        FileStorage s = new FileStorage(dir, "s1:node/with odd chars");
        assertEquals("s1_node_with_odd_chars", s.file().getFileName().toString());
        appendAndRead(s);

        s.release();
        assertFalse(Files.exists(s.file()));
        s.release();
    }

    @Test(expected = IllegalStateException.class)
    public void testFileReleasedStorageRejectsReads() throws Exception {
        FileStorage s = new FileStorage(Files.createTempDirectory("dfe-storage"), "n");
        s.release();
        s.read(0, 1);
    }

    @Test
    public void testChecksumsByName() {
        assertSame(Checksums.CRC_32, Checksums.byName("crc32"));
        assertSame(Checksums.CRC_32C, Checksums.byName("CRC32C"));
        assertSame(Checksums.CRC_32, Checksums.byName(null));
        assertTrue(Checksums.CRC_32C.newChecksum() instanceof CRC32C);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownChecksum() {
        Checksums.byName("md5");
    }

    @Test
    public void testCrc32OfKnownInput() {
        // Standard check value of CRC-32
        assertEquals(0xCBF43926L, Checksums.crc32("123456789".getBytes(StandardCharsets.US_ASCII)));
    }
}
