package com.scidata.dfe.api;

/**
 * Byte buffer backing a node.
 *
 * Implementations decide where bytes live (heap, file). The node serializes
 * appends; reads happen only after the node is COMPLETE, so implementations need
 * no locking of their own beyond visibility.
 */
public interface DataStorage {

    void append(byte[] data, int offset, int length);

    long size();

    /**
     * Reads up to {@code maxBytes} bytes starting at {@code position}.
     *
     * @return The bytes read; empty when position is at or beyond the end.
     */
    byte[] read(long position, int maxBytes);

    /** Releases the underlying buffer. Further calls to other methods are illegal. */
    void release();
}
