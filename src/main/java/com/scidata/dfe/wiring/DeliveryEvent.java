package com.scidata.dfe.wiring;

import com.scidata.dfe.api.NodeEvent;

/**
 * A mutable slot in the remote delivery ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is created and reused for every
 * remote delivery; producers fill a slot with {@link #set} and the dispatcher
 * thread clears it once the delivery is handed to its lane.
 */
public final class DeliveryEvent {
    private NodeEvent event;
    private String targetInstanceId;
    private String targetManagerId;
    private EventChannel channel;

    public void set(NodeEvent event, String targetInstanceId, String targetManagerId, EventChannel channel) {
        this.event = event;
        this.targetInstanceId = targetInstanceId;
        this.targetManagerId = targetManagerId;
        this.channel = channel;
    }

    public NodeEvent event() {
        return event;
    }

    public String targetInstanceId() {
        return targetInstanceId;
    }

    public String targetManagerId() {
        return targetManagerId;
    }

    public EventChannel channel() {
        return channel;
    }

    public void clear() {
        event = null;
        targetInstanceId = null;
        targetManagerId = null;
        channel = null;
    }
}
