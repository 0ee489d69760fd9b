package com.scidata.dfe.web;

import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeRef;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.api.ReadHandle;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.exception.NodeFailedException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A node hosted by a remote manager, seen through its {@link RemoteNodeManager}.
 *
 * Identity is fixed at lookup; state, sizes and checksum are fetched on every
 * call. Reads fetch the whole content once per handle, which suits the
 * small-to-medium outputs exchanged between managers.
 *
 * Wiring and teardown are not available through a proxy: both are the hosting
 * manager's job.
 */
public final class RemoteNodeProxy implements DataNode {
    private final RemoteNodeManager manager;
    private final String instanceId;
    private final String objectId;
    private final String sessionId;
    private final boolean container;
    private final Map<Long, RemoteHandle> handles = new ConcurrentHashMap<>();
    private final AtomicLong handleSequence = new AtomicLong();

    RemoteNodeProxy(RemoteNodeManager manager, NodeInfo info) {
        this.manager = manager;
        this.instanceId = info.instanceId();
        this.objectId = info.objectId();
        this.sessionId = info.sessionId();
        this.container = info.container();
    }

    @Override
    public String objectId() {
        return objectId;
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String managerId() {
        return manager.managerId();
    }

    public NodeInfo info() {
        return manager.describe(instanceId);
    }

    @Override
    public NodeState state() {
        return info().state();
    }

    @Override
    public long expectedSize() {
        return info().expectedSize();
    }

    @Override
    public long bytesWritten() {
        return info().bytesWritten();
    }

    @Override
    public long derivedValue() {
        return info().derivedValue();
    }

    @Override
    public int write(byte[] data) {
        return manager.write(instanceId, data);
    }

    @Override
    public void setCompleted() {
        manager.setCompleted(instanceId);
    }

    @Override
    public void fail(Throwable cause) {
        manager.fail(instanceId, cause == null ? "failed remotely" : String.valueOf(cause.getMessage()));
    }

    @Override
    public ReadHandle open() {
        NodeState s = state();
        if (s == NodeState.ERROR)
            throw new NodeFailedException(instanceId, "open");
        if (s != NodeState.COMPLETE)
            throw new InvalidStateTransitionException(instanceId, s, "open");
        RemoteHandle h = new RemoteHandle(handleSequence.incrementAndGet());
        handles.put(h.id, h);
        return h;
    }

    @Override
    public byte[] read(ReadHandle handle) {
        RemoteHandle h = checkHandle(handle);
        byte[] content = h.content();
        byte[] rest = Arrays.copyOfRange(content, h.position, content.length);
        h.position = content.length;
        return rest;
    }

    @Override
    public byte[] read(ReadHandle handle, int maxBytes) {
        RemoteHandle h = checkHandle(handle);
        byte[] content = h.content();
        int end = (int) Math.min(content.length, (long) h.position + maxBytes);
        byte[] chunk = Arrays.copyOfRange(content, h.position, end);
        h.position = end;
        return chunk;
    }

    @Override
    public void close(ReadHandle handle) {
        if (handle instanceof RemoteHandle h)
            handles.remove(h.id);
    }

    private RemoteHandle checkHandle(ReadHandle handle) {
        if (!(handle instanceof RemoteHandle h) || handles.get(h.id) != h)
            throw new IllegalArgumentException("Unknown or closed read handle for node " + instanceId);
        return h;
    }

    @Override
    public void addConsumer(DataNode consumer) {
        throw new UnsupportedOperationException("Consumers of " + instanceId + " are wired by its manager");
    }

    @Override
    public List<String> consumers() {
        return info().consumers();
    }

    @Override
    public boolean isContainer() {
        return container;
    }

    /**
     * Children of a remote container, resolved through discovery when they live
     * on yet another manager.
     */
    @Override
    public List<DataNode> children() {
        if (!container)
            return List.of();
        List<DataNode> result = new ArrayList<>();
        for (NodeRef ref : info().children()) {
            if (ref.managerId() == null || ref.managerId().equals(manager.managerId())) {
                result.add(manager.lookup(ref.instanceId()));
            } else {
                ManagerDiscovery discovery = manager.discovery();
                if (discovery == null)
                    throw new DataflowException("Cannot resolve child " + ref + " of " + instanceId
                            + ": no discovery attached");
                result.add(discovery.resolve(ref.managerId()).lookup(ref.instanceId()));
            }
        }
        return result;
    }

    @Override
    public NodeState expire() {
        throw new UnsupportedOperationException("Node " + instanceId + " is torn down by its manager");
    }

    @Override
    public String toString() {
        return "RemoteNodeProxy[" + instanceId + "@" + manager.managerId() + "]";
    }

    private final class RemoteHandle implements ReadHandle {
        private final long id;
        private byte[] content;
        private int position;

        RemoteHandle(long id) {
            this.id = id;
        }

        byte[] content() {
            if (content == null)
                content = manager.readAll(instanceId);
            return content;
        }

        @Override
        public long id() {
            return id;
        }

        @Override
        public String instanceId() {
            return instanceId;
        }

        @Override
        public void close() {
            RemoteNodeProxy.this.close(this);
        }
    }
}
