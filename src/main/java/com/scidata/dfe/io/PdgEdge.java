package com.scidata.dfe.io;

import com.scidata.dfe.api.NodeRef;

/**
 * One edge of the physical graph.
 *
 * For PRODUCER_CONSUMER edges {@code from} is the producer and {@code to} the
 * consumer. For CONTAINER_CHILD edges {@code from} is the container and
 * {@code to} the child.
 */
public record PdgEdge(Kind kind, NodeRef from, NodeRef to) {

    public enum Kind {
        PRODUCER_CONSUMER,
        CONTAINER_CHILD
    }

    public static PdgEdge producerConsumer(NodeRef producer, NodeRef consumer) {
        return new PdgEdge(Kind.PRODUCER_CONSUMER, producer, consumer);
    }

    public static PdgEdge containerChild(NodeRef container, NodeRef child) {
        return new PdgEdge(Kind.CONTAINER_CHILD, container, child);
    }

    /** The end whose events flow along the edge: producer, or child. */
    public NodeRef publisher() {
        return kind == Kind.PRODUCER_CONSUMER ? from : to;
    }

    /** The end that reacts to those events: consumer, or container. */
    public NodeRef receiver() {
        return kind == Kind.PRODUCER_CONSUMER ? to : from;
    }

    public boolean crossesManagers() {
        return from.managerId() != null && !from.managerId().equals(to.managerId());
    }

    @Override
    public String toString() {
        return kind + "(" + from + " -> " + to + ")";
    }
}
