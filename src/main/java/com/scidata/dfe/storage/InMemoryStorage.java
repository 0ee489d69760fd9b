package com.scidata.dfe.storage;

import com.scidata.dfe.api.DataStorage;

import java.util.Arrays;

/**
 * Heap-backed node storage. Grows geometrically, like a byte array output
 * stream, but supports positional reads for read handles.
 */
public final class InMemoryStorage implements DataStorage {
    private static final int INITIAL_CAPACITY = 256;

    private byte[] buffer;
    private int size;
    private boolean released;

    public InMemoryStorage() {
        this(INITIAL_CAPACITY);
    }

    /** Pre-sizes the buffer, useful when the node's expected size is known. */
    public InMemoryStorage(int initialCapacity) {
        this.buffer = new byte[Math.max(16, initialCapacity)];
    }

    @Override
    public synchronized void append(byte[] data, int offset, int length) {
        checkLive();
        ensureCapacity(size + length);
        System.arraycopy(data, offset, buffer, size, length);
        size += length;
    }

    @Override
    public synchronized long size() {
        return size;
    }

    @Override
    public synchronized byte[] read(long position, int maxBytes) {
        checkLive();
        if (position >= size)
            return new byte[0];
        int from = (int) position;
        int to = (int) Math.min((long) size, position + maxBytes);
        return Arrays.copyOfRange(buffer, from, to);
    }

    @Override
    public synchronized void release() {
        buffer = new byte[0];
        size = 0;
        released = true;
    }

    private void ensureCapacity(int required) {
        if (required <= buffer.length)
            return;
        int newCapacity = Math.max(required, buffer.length << 1);
        buffer = Arrays.copyOf(buffer, newCapacity);
    }

    private void checkLive() {
        if (released)
            throw new IllegalStateException("Storage already released");
    }
}
