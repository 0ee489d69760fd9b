package com.scidata.dfe.wiring;

import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;
import com.scidata.dfe.exception.DeliveryException;
import com.scidata.dfe.exception.DuplicateConsumerException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-session delivery mechanism for node lifecycle events.
 *
 * This is not a global bus: every session owns exactly one channel, and a node
 * publishes only to the subscribers registered on its own instance id.
 *
 * Delivery Contract:
 * - Subscribers of a source are notified in registration order.
 * - Local subscribers are called synchronously on the publishing thread, which is
 * how completion cascades down a chain of in-process nodes.
 * - Remote subscribers are queued on the {@link RemoteEventDispatcher}; the
 * publisher never waits for the network.
 * - A failing subscriber is logged (and, when remote, its edge marked broken)
 * without affecting delivery to the remaining subscribers.
 *
 * No ordering is promised across different sources.
 */
public final class EventChannel {
    private static final Logger log = LogManager.getLogger(EventChannel.class);

    private final String sessionId;
    private final Map<String, List<Subscriber>> subscribers = new ConcurrentHashMap<>();
    private final Set<String> brokenEdges = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public EventChannel(String sessionId) {
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    /** Convenience for in-process subscriptions. */
    public void subscribe(String sourceId, String targetId, NodeEventListener listener) {
        subscribe(sourceId, new LocalSubscriber(targetId, listener));
    }

    /**
     * Registers a subscriber for the events of {@code sourceId}.
     *
     * @throws DuplicateConsumerException if the target is already subscribed to the
     *                                    source.
     */
    public void subscribe(String sourceId, Subscriber subscriber) {
        List<Subscriber> list = subscribers.computeIfAbsent(sourceId, k -> new CopyOnWriteArrayList<>());
        synchronized (list) {
            for (Subscriber s : list) {
                if (s.targetId().equals(subscriber.targetId()))
                    throw new DuplicateConsumerException(sourceId, subscriber.targetId());
            }
            list.add(subscriber);
        }
        log.debug("[{}] {} subscribed to {} ({})", sessionId, subscriber.targetId(), sourceId,
                subscriber.isRemote() ? "remote" : "local");
    }

    /** Subscribers of a source, in notification order. */
    public List<Subscriber> subscribers(String sourceId) {
        List<Subscriber> list = subscribers.get(sourceId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * Publishes an event from {@code sourceId} to all of its subscribers.
     *
     * @return The published event.
     */
    public NodeEvent publish(String sourceId, EventKind kind) {
        NodeEvent event = NodeEvent.of(sourceId, sessionId, kind);
        if (closed) {
            log.debug("[{}] Channel closed, dropping {} from {}", sessionId, kind, sourceId);
            return event;
        }
        List<Subscriber> list = subscribers.get(sourceId);
        if (list == null)
            return event;

        for (Subscriber s : list) {
            if (brokenEdges.contains(edgeKey(sourceId, s.targetId())))
                continue;
            try {
                s.deliver(event);
            } catch (DeliveryException e) {
                markBroken(sourceId, s.targetId());
                log.error("[{}] Delivery of {} from {} to {} failed", sessionId, kind, sourceId, s.targetId(), e);
            } catch (RuntimeException e) {
                // A local handler failing must not stop the fan-out
                log.error("[{}] Subscriber {} failed handling {} from {}", sessionId, s.targetId(), kind, sourceId, e);
            }
        }
        return event;
    }

    /** Marks the edge source -> target as broken; it receives no further events. */
    public void markBroken(String sourceId, String targetId) {
        if (brokenEdges.add(edgeKey(sourceId, targetId)))
            log.warn("[{}] Edge {} -> {} marked broken", sessionId, sourceId, targetId);
    }

    public boolean isBroken(String sourceId, String targetId) {
        return brokenEdges.contains(edgeKey(sourceId, targetId));
    }

    /** Broken edges formatted as {@code source->target}. */
    public Set<String> brokenEdges() {
        return Set.copyOf(brokenEdges);
    }

    /** Drops a source's subscriptions, e.g. when its node is torn down. */
    public void unsubscribeAll(String sourceId) {
        subscribers.remove(sourceId);
    }

    /** Stops all further delivery. Used on session teardown. */
    public void close() {
        closed = true;
        subscribers.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private static String edgeKey(String sourceId, String targetId) {
        return sourceId + "->" + targetId;
    }
}
