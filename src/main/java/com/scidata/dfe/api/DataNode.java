package com.scidata.dfe.api;

import java.util.List;

/**
 * A data-holding node of the physical dataflow graph.
 *
 * This interface is the unit every part of the engine talks to: application
 * logic writes into it and reads from it, the node manager creates and expires
 * it, and the execution coordinator drives its roots.
 *
 * Key Responsibilities:
 *
 * 1. Identity: objectId is the logical (pipeline-level) name and may be shared by
 * equivalent instances; instanceId is unique for the run.
 *
 * 2. Lifecycle: see {@link NodeState}. Illegal operations fail synchronously with
 * InvalidStateTransitionException (NodeFailedException once the node is in
 * ERROR).
 *
 * 3. Data: bytes are appended by a single writer and folded into a running
 * checksum (derivedValue). The checksum depends on the byte sequence only, never
 * on how writes were chunked.
 *
 * 4. Notification: completion and failure are published exactly once on the
 * session's event channel, which delivers them to registered consumers.
 *
 * Threading:
 * Writes must come from one thread at a time. State reads and event handling are
 * safe from any thread.
 */
public interface DataNode {

    /** Logical identifier, shared by conceptually equivalent instances. */
    String objectId();

    /** Unique identifier of this instance. */
    String instanceId();

    /** Session that owns this node. */
    String sessionId();

    /** Id of the node manager hosting this node, or null for standalone nodes. */
    default String managerId() {
        return null;
    }

    NodeState state();

    /** Expected size in bytes, or -1 when the node completes only on request. */
    long expectedSize();

    long bytesWritten();

    /** Running checksum of everything written so far. */
    long derivedValue();

    /**
     * Appends data to the node.
     *
     * The first write moves the node from INITIALIZED to WRITING. When an expected
     * size is set and reached, the node completes itself.
     *
     * @param data Bytes to append.
     * @return Number of bytes accepted.
     */
    int write(byte[] data);

    /**
     * Marks the node COMPLETE and publishes the COMPLETE event.
     *
     * Legal from WRITING, and from INITIALIZED for zero-byte nodes.
     */
    void setCompleted();

    /**
     * Moves the node to ERROR and publishes the ERROR event. A no-op on a node
     * that already reached a terminal state.
     */
    void fail(Throwable cause);

    /** Opens a read handle. Legal only once COMPLETE. */
    ReadHandle open();

    /** Reads everything remaining from the handle's position. */
    byte[] read(ReadHandle handle);

    /** Reads at most {@code maxBytes} from the handle's position. Empty at end. */
    byte[] read(ReadHandle handle, int maxBytes);

    void close(ReadHandle handle);

    /**
     * Registers a downstream node that consumes this node's content.
     *
     * @throws com.scidata.dfe.exception.DuplicateConsumerException if the
     *                                                              consumer is
     *                                                              already
     *                                                              registered.
     */
    void addConsumer(DataNode consumer);

    /** Instance ids of registered consumers, in notification order. */
    List<String> consumers();

    boolean isContainer();

    /** Registers a child. Supported by container nodes only. */
    default void addChild(DataNode child) {
        throw new UnsupportedOperationException("Node " + instanceId() + " is not a container");
    }

    /** Children in registration order. Empty for non-container nodes. */
    default List<DataNode> children() {
        return List.of();
    }

    /**
     * Tears the node down: releases its storage and moves it to EXPIRED.
     *
     * @return The state the node was in before expiring.
     */
    NodeState expire();
}
