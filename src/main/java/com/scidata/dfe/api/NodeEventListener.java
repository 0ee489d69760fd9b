package com.scidata.dfe.api;

/**
 * Receiver side of an event channel subscription.
 *
 * Consumer nodes and container nodes implement this to react to the completion
 * (or failure) of the nodes they depend on. Delivery is at-least-once, so
 * implementations must tolerate seeing the same event more than once.
 */
@FunctionalInterface
public interface NodeEventListener {

    /**
     * Called for every event published by a node this listener subscribed to.
     *
     * @param event The event. Never null.
     */
    void onEvent(NodeEvent event);
}
