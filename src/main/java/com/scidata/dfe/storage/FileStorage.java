package com.scidata.dfe.storage;

import com.scidata.dfe.api.DataStorage;
import com.scidata.dfe.exception.DataflowException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * File-backed node storage.
 *
 * Each node gets its own file under the configured directory, created on
 * construction and deleted on release. Appends go through a single FileChannel
 * opened for the lifetime of the node.
 */
public final class FileStorage implements DataStorage {
    private static final Logger log = LogManager.getLogger(FileStorage.class);

    private final Path file;
    private FileChannel channel;

    /**
     * @param directory Parent directory; created if missing.
     * @param fileName  File name, usually derived from the node instance id.
     */
    public FileStorage(Path directory, String fileName) {
        try {
            Files.createDirectories(directory);
            this.file = directory.resolve(sanitize(fileName));
            this.channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new DataflowException("Failed to create storage file " + fileName + " in " + directory, e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void append(byte[] data, int offset, int length) {
        ByteBuffer src = ByteBuffer.wrap(data, offset, length);
        try {
            FileChannel ch = liveChannel();
            long pos = ch.size();
            while (src.hasRemaining())
                pos += ch.write(src, pos);
        } catch (IOException e) {
            throw new DataflowException("Write to " + file + " failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try {
            return liveChannel().size();
        } catch (IOException e) {
            throw new DataflowException("Cannot stat " + file, e);
        }
    }

    @Override
    public synchronized byte[] read(long position, int maxBytes) {
        try {
            FileChannel ch = liveChannel();
            long remaining = ch.size() - position;
            if (remaining <= 0)
                return new byte[0];
            ByteBuffer dst = ByteBuffer.allocate((int) Math.min(remaining, maxBytes));
            long pos = position;
            while (dst.hasRemaining()) {
                int n = ch.read(dst, pos);
                if (n < 0)
                    break;
                pos += n;
            }
            return dst.array();
        } catch (IOException e) {
            throw new DataflowException("Read from " + file + " failed", e);
        }
    }

    @Override
    public synchronized void release() {
        if (channel == null)
            return;
        try {
            channel.close();
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not clean up storage file {}: {}", file, e.getMessage());
        } finally {
            channel = null;
        }
    }

    private FileChannel liveChannel() {
        if (channel == null)
            throw new IllegalStateException("Storage already released: " + file);
        return channel;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
