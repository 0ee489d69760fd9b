package com.scidata.dfe.wiring;

import com.scidata.dfe.api.NodeEvent;

/**
 * One entry of a source's subscription list on an {@link EventChannel}.
 */
public interface Subscriber {

    /** Instance id of the node that receives the events. */
    String targetId();

    /**
     * Hands the event to the target. Local subscribers run the target's handler
     * inline; remote subscribers enqueue the event and return.
     *
     * @throws com.scidata.dfe.exception.DeliveryException if the event could not
     *                                                     be handed over.
     */
    void deliver(NodeEvent event);

    boolean isRemote();
}
