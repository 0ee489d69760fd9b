package com.scidata.dfe.api;

/**
 * A lifecycle notification published by a node.
 *
 * This is also the wire shape of remote deliveries, so it is a plain record that
 * Jackson can serialize without extra configuration.
 *
 * @param sourceInstanceId Instance id of the publishing node.
 * @param sessionId        Session the source node belongs to.
 * @param kind             COMPLETE or ERROR.
 * @param timestamp        Epoch millis at publication time.
 */
public record NodeEvent(String sourceInstanceId, String sessionId, EventKind kind, long timestamp) {

    public static NodeEvent of(String sourceInstanceId, String sessionId, EventKind kind) {
        return new NodeEvent(sourceInstanceId, sessionId, kind, System.currentTimeMillis());
    }

    public boolean isComplete() {
        return kind == EventKind.COMPLETE;
    }
}
