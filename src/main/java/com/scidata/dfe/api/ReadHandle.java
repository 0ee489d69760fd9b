package com.scidata.dfe.api;

/**
 * Scoped read access to the content of a COMPLETE node.
 *
 * Obtained from {@link DataNode#open()}. Closing the handle releases it on the
 * owning node, so the usual pattern is try-with-resources:
 *
 * <pre>
 * try (ReadHandle h = node.open()) {
 *     byte[] all = node.read(h);
 * }
 * </pre>
 */
public interface ReadHandle extends AutoCloseable {

    /** Identifier of the handle, unique within its node. */
    long id();

    /** Instance id of the node this handle reads from. */
    String instanceId();

    /** Releases the handle. Calling it more than once has no effect. */
    @Override
    void close();
}
