package com.scidata.dfe.wiring;

import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;

/** In-process subscription: delivery is a direct synchronous call. */
public record LocalSubscriber(String targetId, NodeEventListener listener) implements Subscriber {

    @Override
    public void deliver(NodeEvent event) {
        listener.onEvent(event);
    }

    @Override
    public boolean isRemote() {
        return false;
    }
}
