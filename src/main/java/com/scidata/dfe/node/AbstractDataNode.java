package com.scidata.dfe.node;

import com.scidata.dfe.api.ChecksumFactory;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.DataStorage;
import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;
import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.api.ReadHandle;
import com.scidata.dfe.exception.DuplicateConsumerException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.exception.NodeFailedException;
import com.scidata.dfe.wiring.EventChannel;
import com.scidata.dfe.wiring.LocalSubscriber;
import com.scidata.dfe.wiring.Subscriber;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.Checksum;

/**
 * Base class implementing the node lifecycle state machine.
 *
 * A node is composed from two capabilities handed in at construction: a
 * {@link DataStorage} holding its bytes and a {@link ChecksumFactory} computing its
 * derived value. Subclasses add behaviour (joins, application logic) on top; they
 * never re-implement the transitions.
 *
 * Design:
 * - State lives in an AtomicReference and every transition is a compare-and-set,
 * so COMPLETE and ERROR are each published at most once even when completion
 * and failure race.
 * - Appends are serialized on a private lock. The single-writer contract is the
 * caller's; the lock only keeps the storage, byte counter and checksum
 * consistent with each other.
 * - Events are published outside of any lock. Publication cascades synchronously
 * into local consumers, which may call back into other nodes.
 */
public abstract class AbstractDataNode implements DataNode {
    private static final Logger log = LogManager.getLogger(AbstractDataNode.class);

    private final String objectId;
    private final String instanceId;
    private final EventChannel channel;
    private final DataStorage storage;
    private final Checksum checksum;
    private final long expectedSize;

    private final AtomicReference<NodeState> state = new AtomicReference<>(NodeState.INITIALIZED);
    private final Object writeLock = new Object();
    private volatile long bytesWritten;
    private volatile long derivedValue;
    private volatile Throwable failureCause;

    // Consumer instance ids in registration order; mirrors the channel subscription list
    private final List<String> consumers = new CopyOnWriteArrayList<>();

    private final Map<Long, NodeReadHandle> openHandles = new ConcurrentHashMap<>();
    private final AtomicLong handleSequence = new AtomicLong();

    private volatile String managerId;
    private volatile NodeLifecycleListener lifecycleListener;

    protected AbstractDataNode(String objectId, String instanceId, EventChannel channel, DataStorage storage,
            ChecksumFactory checksums, long expectedSize) {
        this.objectId = objectId;
        this.instanceId = instanceId;
        this.channel = channel;
        this.storage = storage;
        this.checksum = checksums.newChecksum();
        this.expectedSize = expectedSize;
        this.derivedValue = checksum.getValue();
    }

    /** Short type label, e.g. "data", "container" or "app:grep". */
    public abstract String kind();

    // ── Identity & properties ────────────────────────────────────

    @Override
    public final String objectId() {
        return objectId;
    }

    @Override
    public final String instanceId() {
        return instanceId;
    }

    @Override
    public final String sessionId() {
        return channel.sessionId();
    }

    @Override
    public final NodeState state() {
        return state.get();
    }

    @Override
    public final long expectedSize() {
        return expectedSize;
    }

    @Override
    public final long bytesWritten() {
        return bytesWritten;
    }

    @Override
    public final long derivedValue() {
        return derivedValue;
    }

    @Override
    public String managerId() {
        return managerId;
    }

    /** Set by the owning node manager at creation. */
    public void setManagerId(String managerId) {
        this.managerId = managerId;
    }

    public final Throwable failureCause() {
        return failureCause;
    }

    public final EventChannel channel() {
        return channel;
    }

    public void setLifecycleListener(NodeLifecycleListener listener) {
        this.lifecycleListener = listener;
    }

    // ── Writing ──────────────────────────────────────────────────

    @Override
    public int write(byte[] data) {
        boolean reachedExpected;
        synchronized (writeLock) {
            NodeState s = state.get();
            while (s == NodeState.INITIALIZED) {
                if (transition(NodeState.INITIALIZED, NodeState.WRITING))
                    break;
                s = state.get();
            }
            checkWritable(state.get());

            storage.append(data, 0, data.length);
            checksum.update(data, 0, data.length);
            derivedValue = checksum.getValue();
            bytesWritten += data.length;
            reachedExpected = expectedSize >= 0 && bytesWritten >= expectedSize;
        }
        if (reachedExpected)
            completeInternal();
        return data.length;
    }

    private void checkWritable(NodeState s) {
        if (s == NodeState.ERROR)
            throw new NodeFailedException(instanceId, "write");
        if (s != NodeState.WRITING)
            throw new InvalidStateTransitionException(instanceId, s, "write");
    }

    // ── Completion & failure ─────────────────────────────────────

    @Override
    public void setCompleted() {
        completeInternal();
    }

    /**
     * Moves the node to COMPLETE and publishes the COMPLETE event.
     *
     * @throws InvalidStateTransitionException if the node is not INITIALIZED or
     *                                         WRITING.
     */
    protected final void completeInternal() {
        NodeState from;
        synchronized (writeLock) {
            from = state.get();
            if (from == NodeState.ERROR)
                throw new NodeFailedException(instanceId, "complete");
            if (!from.acceptsWrites() || !transition(from, NodeState.COMPLETE)) {
                NodeState now = state.get();
                if (now == NodeState.ERROR)
                    throw new NodeFailedException(instanceId, "complete");
                throw new InvalidStateTransitionException(instanceId, now, "complete");
            }
        }
        log.debug("{} COMPLETE ({} bytes, checksum {})", instanceId, bytesWritten, derivedValue);
        channel.publish(instanceId, EventKind.COMPLETE);
    }

    @Override
    public void fail(Throwable cause) {
        while (true) {
            NodeState s = state.get();
            if (s.isTerminal()) {
                log.debug("{} already {}, ignoring failure: {}", instanceId, s,
                        cause == null ? null : cause.getMessage());
                return;
            }
            if (transition(s, NodeState.ERROR))
                break;
        }
        failureCause = cause;
        log.warn("{} ERROR: {}", instanceId, cause == null ? "unknown cause" : cause.getMessage());
        NodeLifecycleListener l = lifecycleListener;
        if (l != null)
            l.onNodeError(instanceId, cause);
        channel.publish(instanceId, EventKind.ERROR);
    }

    @Override
    public NodeState expire() {
        NodeState prev;
        do {
            prev = state.get();
            if (prev == NodeState.EXPIRED)
                return prev;
        } while (!transition(prev, NodeState.EXPIRED));

        openHandles.clear();
        storage.release();
        channel.unsubscribeAll(instanceId);
        return prev;
    }

    private boolean transition(NodeState from, NodeState to) {
        if (!state.compareAndSet(from, to))
            return false;
        NodeLifecycleListener l = lifecycleListener;
        if (l != null)
            l.onTransition(instanceId, from, to, System.nanoTime());
        return true;
    }

    // ── Reading ──────────────────────────────────────────────────

    @Override
    public ReadHandle open() {
        checkReadable("open");
        NodeReadHandle handle = new NodeReadHandle(this, handleSequence.incrementAndGet());
        openHandles.put(handle.id(), handle);
        return handle;
    }

    @Override
    public byte[] read(ReadHandle handle) {
        NodeReadHandle h = checkHandle(handle);
        long remaining = storage.size() - h.position;
        byte[] data = storage.read(h.position, (int) Math.max(0, Math.min(remaining, Integer.MAX_VALUE - 8)));
        h.position += data.length;
        return data;
    }

    @Override
    public byte[] read(ReadHandle handle, int maxBytes) {
        NodeReadHandle h = checkHandle(handle);
        byte[] data = storage.read(h.position, maxBytes);
        h.position += data.length;
        return data;
    }

    @Override
    public void close(ReadHandle handle) {
        if (handle instanceof NodeReadHandle h && h.owner == this)
            openHandles.remove(h.id());
    }

    /** Number of read handles currently open. */
    public int openHandleCount() {
        return openHandles.size();
    }

    private NodeReadHandle checkHandle(ReadHandle handle) {
        checkReadable("read");
        if (!(handle instanceof NodeReadHandle h) || h.owner != this || !openHandles.containsKey(h.id()))
            throw new IllegalArgumentException("Unknown or closed read handle for node " + instanceId);
        return h;
    }

    private void checkReadable(String operation) {
        NodeState s = state.get();
        if (s == NodeState.ERROR)
            throw new NodeFailedException(instanceId, operation);
        if (s != NodeState.COMPLETE)
            throw new InvalidStateTransitionException(instanceId, s, operation);
    }

    // ── Consumers & subscriptions ────────────────────────────────

    /**
     * Registers an in-process consumer. The consumer must be able to receive
     * events; consumer nodes also learn about this node as one of their producers.
     */
    @Override
    public void addConsumer(DataNode consumer) {
        if (!(consumer instanceof NodeEventListener listener))
            throw new IllegalArgumentException("Node " + consumer.instanceId() + " cannot consume events");
        if (consumer instanceof ConsumerNode cn)
            cn.addProducer(this);
        addConsumerSubscription(new LocalSubscriber(consumer.instanceId(), listener));
    }

    /**
     * Registers a consumer through an arbitrary subscriber, typically a remote one
     * pointing at a node hosted by another manager.
     */
    public void addConsumerSubscription(Subscriber subscriber) {
        String consumerId = subscriber.targetId();
        synchronized (consumers) {
            if (consumers.contains(consumerId))
                throw new DuplicateConsumerException(instanceId, consumerId);
            consumers.add(consumerId);
        }
        watch(subscriber);
    }

    /**
     * Subscribes to this node's events without registering as a consumer. Used by
     * containers watching their children.
     *
     * If the node already reached COMPLETE or ERROR the subscriber also gets that
     * event replayed, so late subscribers never miss an outcome. Delivery is
     * at-least-once; receivers deduplicate.
     */
    public void watch(Subscriber subscriber) {
        channel.subscribe(instanceId, subscriber);
        NodeState s = state.get();
        if (s == NodeState.COMPLETE || s == NodeState.ERROR) {
            EventKind kind = s == NodeState.COMPLETE ? EventKind.COMPLETE : EventKind.ERROR;
            subscriber.deliver(NodeEvent.of(instanceId, sessionId(), kind));
        }
    }

    @Override
    public List<String> consumers() {
        return List.copyOf(consumers);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + instanceId + ", " + state.get() + "]";
    }

    /** Read handle bound to its node; tracks its own read position. */
    private static final class NodeReadHandle implements ReadHandle {
        private final AbstractDataNode owner;
        private final long id;
        private long position;

        NodeReadHandle(AbstractDataNode owner, long id) {
            this.owner = owner;
            this.id = id;
        }

        @Override
        public long id() {
            return id;
        }

        @Override
        public String instanceId() {
            return owner.instanceId;
        }

        @Override
        public void close() {
            owner.close(this);
        }
    }
}
