package com.scidata.dfe.node;

import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.storage.Checksums;
import com.scidata.dfe.storage.InMemoryStorage;
import com.scidata.dfe.wiring.EventChannel;
import com.scidata.dfe.wiring.LocalSubscriber;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A node that groups children and completes when all of them have completed
 * (AND-join).
 *
 * <p>
 * The container holds no bytes of its own. It keeps a counter of outstanding
 * children, incremented by {@link #addChild} and decremented once per distinct
 * child completion; the transition to COMPLETE happens when the counter reaches
 * zero. Any child failure fails the container immediately.
 *
 * <p>
 * Children must all be registered before the first of them completes, otherwise
 * the counter can reach zero early. The graph builder guarantees this by wiring
 * before any data is written.
 */
public final class ContainerNode extends AbstractDataNode implements NodeEventListener {
    private static final Logger log = LogManager.getLogger(ContainerNode.class);

    private final List<DataNode> children = new CopyOnWriteArrayList<>();
    private final Set<String> childIds = ConcurrentHashMap.newKeySet();
    private final Set<String> completedChildren = ConcurrentHashMap.newKeySet();
    private final AtomicInteger outstanding = new AtomicInteger();

    public ContainerNode(String objectId, String instanceId, EventChannel channel) {
        super(objectId, instanceId, channel, new InMemoryStorage(16), Checksums.CRC_32, -1);
    }

    @Override
    public String kind() {
        return "container";
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    /**
     * Registers a child and subscribes to its events. In-process children are
     * watched directly; for a child on another manager use
     * {@link #addRemoteChild}.
     */
    @Override
    public void addChild(DataNode child) {
        register(child);
        if (child instanceof AbstractDataNode local) {
            local.watch(new LocalSubscriber(instanceId(), this));
        } else {
            replayRemoteState(child);
        }
    }

    /**
     * Registers a child hosted by another manager. The subscription lives on the
     * child's manager; this side only counts the child.
     */
    public void addRemoteChild(DataNode child) {
        register(child);
    }

    private void register(DataNode child) {
        NodeState s = state();
        if (s.isTerminal())
            throw new InvalidStateTransitionException(instanceId(), s, "add child to");
        if (child.instanceId().equals(instanceId()))
            throw new IllegalArgumentException("Container " + instanceId() + " cannot contain itself");
        if (!childIds.add(child.instanceId()))
            throw new IllegalArgumentException("Duplicate child " + child.instanceId() + " in " + instanceId());
        children.add(child);
        outstanding.incrementAndGet();
    }

    private void replayRemoteState(DataNode child) {
        NodeState s = child.state();
        if (s == NodeState.COMPLETE || s == NodeState.ERROR) {
            onEvent(NodeEvent.of(child.instanceId(), sessionId(),
                    s == NodeState.COMPLETE ? EventKind.COMPLETE : EventKind.ERROR));
        }
    }

    @Override
    public void onEvent(NodeEvent event) {
        String childId = event.sourceInstanceId();
        if (!childIds.contains(childId)) {
            log.warn("{} ignoring event from non-child {}", instanceId(), childId);
            return;
        }
        if (state().isTerminal())
            return;

        if (event.kind() == EventKind.ERROR) {
            fail(new DataflowException("Child " + childId + " of " + instanceId() + " failed"));
            return;
        }
        // Remote delivery is at-least-once; count each child once
        if (completedChildren.add(childId) && outstanding.decrementAndGet() == 0) {
            try {
                completeInternal();
            } catch (InvalidStateTransitionException e) {
                log.debug("{} join raced with {}: {}", instanceId(), e.state(), e.getMessage());
            }
        }
    }

    /**
     * Completes a container manually. Only legal while no child is outstanding,
     * i.e. for containers that never had children.
     */
    @Override
    public void setCompleted() {
        int pending = outstanding.get();
        if (pending > 0)
            throw new InvalidStateTransitionException(instanceId(), state(),
                    "complete (" + pending + " children outstanding)");
        completeInternal();
    }

    /** Containers hold no content of their own. */
    @Override
    public int write(byte[] data) {
        throw new InvalidStateTransitionException(instanceId(), state(), "write to container");
    }

    @Override
    public List<DataNode> children() {
        return List.copyOf(children);
    }

    public int outstandingChildren() {
        return outstanding.get();
    }
}
