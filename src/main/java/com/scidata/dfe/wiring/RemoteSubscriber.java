package com.scidata.dfe.wiring;

import com.scidata.dfe.api.NodeEvent;

/**
 * Subscription of a node hosted by another manager. Delivery is handed to the
 * {@link RemoteEventDispatcher}, which performs the RPC (with bounded retries) on
 * the delivery lane of the target manager.
 */
public record RemoteSubscriber(String targetId, String targetManagerId, RemoteEventDispatcher dispatcher,
        EventChannel channel) implements Subscriber {

    @Override
    public void deliver(NodeEvent event) {
        dispatcher.dispatch(event, targetId, targetManagerId, channel);
    }

    @Override
    public boolean isRemote() {
        return true;
    }
}
