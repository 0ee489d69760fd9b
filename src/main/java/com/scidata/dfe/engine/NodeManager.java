package com.scidata.dfe.engine;

import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;
import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeManagerService;
import com.scidata.dfe.api.NodeRef;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.DeliveryException;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.exception.ResourceUnavailableException;
import com.scidata.dfe.exception.UnknownNodeException;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.EngineConfig;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;
import com.scidata.dfe.node.AbstractDataNode;
import com.scidata.dfe.node.ConsumerNode;
import com.scidata.dfe.node.ContainerNode;
import com.scidata.dfe.node.NodeContents;
import com.scidata.dfe.util.CompositeLifecycleListener;
import com.scidata.dfe.wiring.EventChannel;
import com.scidata.dfe.wiring.RemoteEventDispatcher;
import com.scidata.dfe.wiring.RemoteSubscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * Registry and factory for the nodes of one process.
 *
 * A node is owned exclusively by the manager that created it; other managers and
 * the coordinator reach it only through this surface. The manager keeps one
 * {@link EventChannel} per session, shared by all of that session's local nodes.
 *
 * Key Responsibilities:
 *
 * 1. Capacity: live plus reserved nodes never exceed
 * {@link EngineConfig#getNodeCapacity()}. Reservations that would overflow are
 * declined.
 *
 * 2. Wiring: for each edge, the manager applies the side(s) it hosts. When both
 * ends are local the nodes are linked directly; otherwise the publishing side
 * gets a {@link RemoteSubscriber} and the receiving side a proxy of the remote
 * end obtained through {@link ManagerDiscovery}.
 *
 * 3. Inbound events: events from other managers run on a fixed set of inbound
 * lanes ({@link EngineConfig#getInboundThreads()}), never on a transport thread.
 * The lane is picked from the target node's instance id, so events for one node
 * are handled in arrival order while different nodes, and the application logic
 * they trigger, progress concurrently.
 *
 * 4. Teardown: shutdownSession expires every node of the session, releasing its
 * storage, and reports whether any node was interrupted mid-write.
 */
@Log4j2
public class NodeManager implements NodeManagerService, AutoCloseable {
    public static final int SHUTDOWN_CLEAN = 0;
    public static final int SHUTDOWN_FORCED = 1;

    private final String managerId;
    private final EngineConfig config;
    private final NodeFactory factory;
    private final CompositeLifecycleListener lifecycleListeners = new CompositeLifecycleListener();

    private final Map<String, ManagerSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, AbstractDataNode> nodes = new ConcurrentHashMap<>();
    private final ExecutorService[] inbound;
    private final Object capacityLock = new Object();
    private int reservedSlots;

    private volatile ManagerDiscovery discovery;
    private volatile RemoteEventDispatcher dispatcher;

    public NodeManager(String managerId) {
        this(managerId, EngineConfig.load(), new AppRegistry());
    }

    public NodeManager(String managerId, EngineConfig config, AppRegistry apps) {
        this.managerId = managerId;
        this.config = config;
        this.factory = new NodeFactory(apps, config);
        this.inbound = new ExecutorService[Math.max(1, config.getInboundThreads())];
        for (int i = 0; i < inbound.length; i++) {
            String name = "dfe-inbound-" + managerId + "-" + i;
            inbound[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    /** Points the manager at the discovery used to reach its peers. */
    public void attach(ManagerDiscovery discovery) {
        this.discovery = discovery;
    }

    public void addLifecycleListener(NodeLifecycleListener listener) {
        lifecycleListeners.addForComposite(listener);
    }

    @Override
    public String managerId() {
        return managerId;
    }

    public EngineConfig config() {
        return config;
    }

    // ── Submission ───────────────────────────────────────────────

    @Override
    public boolean reserve(String sessionId, List<NodeDescriptor> descriptors) {
        for (NodeDescriptor d : descriptors) {
            try {
                factory.validate(d);
            } catch (GraphConstructionException e) {
                log.warn("[{}] Declining session {}: {}", managerId, sessionId, e.getMessage());
                return false;
            }
            if (d.getInstanceId() != null && nodes.containsKey(d.getInstanceId())) {
                log.warn("[{}] Declining session {}: node {} already exists", managerId, sessionId,
                        d.getInstanceId());
                return false;
            }
        }
        synchronized (capacityLock) {
            int demand = nodes.size() + reservedSlots + descriptors.size();
            if (demand > config.getNodeCapacity()) {
                log.warn("[{}] Declining session {}: {} nodes requested, {} live, {} reserved, capacity {}",
                        managerId, sessionId, descriptors.size(), nodes.size(), reservedSlots,
                        config.getNodeCapacity());
                return false;
            }
            reservedSlots += descriptors.size();
            session(sessionId).reserved.addAll(descriptors);
        }
        log.debug("[{}] Reserved {} nodes for session {}", managerId, descriptors.size(), sessionId);
        return true;
    }

    @Override
    public void release(String sessionId) {
        ManagerSession s = sessions.get(sessionId);
        if (s == null)
            return;
        synchronized (capacityLock) {
            reservedSlots -= s.reserved.size();
            s.reserved.clear();
        }
        if (s.nodes.isEmpty() && sessions.remove(sessionId, s))
            s.channel.close();
        log.debug("[{}] Released reservation of session {}", managerId, sessionId);
    }

    @Override
    public List<String> commit(String sessionId) {
        ManagerSession s = sessions.get(sessionId);
        List<NodeDescriptor> reserved;
        synchronized (capacityLock) {
            if (s == null || s.reserved.isEmpty())
                throw new ResourceUnavailableException(
                        "Manager " + managerId + " holds no reservation for session " + sessionId);
            reserved = new ArrayList<>(s.reserved);
            reservedSlots -= reserved.size();
            s.reserved.clear();
        }

        List<String> created = new ArrayList<>(reserved.size());
        try {
            for (NodeDescriptor d : reserved)
                created.add(createNode(s, d));
        } catch (RuntimeException e) {
            log.error("[{}] Commit of session {} failed after {} of {} nodes", managerId, sessionId,
                    created.size(), reserved.size(), e);
            for (String id : created)
                destroy(s, id);
            throw e;
        }
        log.info("[{}] Session {}: created {} nodes", managerId, sessionId, created.size());
        return created;
    }

    @Override
    public String registerNode(NodeDescriptor descriptor, String sessionId) {
        // The slot stays reserved until the node is in the map
        synchronized (capacityLock) {
            if (nodes.size() + reservedSlots >= config.getNodeCapacity())
                throw new ResourceUnavailableException(
                        "Manager " + managerId + " is at capacity (" + config.getNodeCapacity() + " nodes)");
            reservedSlots++;
        }
        try {
            return createNode(session(sessionId), descriptor);
        } finally {
            synchronized (capacityLock) {
                reservedSlots--;
            }
        }
    }

    private String createNode(ManagerSession s, NodeDescriptor d) {
        if (d.getInstanceId() == null)
            d.setInstanceId(s.id + ":" + UUID.randomUUID());
        AbstractDataNode node = factory.create(d, s.channel);
        node.setManagerId(managerId);
        if (lifecycleListeners.size() > 0)
            node.setLifecycleListener(lifecycleListeners);
        if (nodes.putIfAbsent(node.instanceId(), node) != null) {
            node.expire();
            throw new IllegalArgumentException("Duplicate node instance id: " + node.instanceId());
        }
        s.nodes.put(node.instanceId(), node);
        log.debug("[{}] Created {} {} ({})", managerId, node.kind(), node.instanceId(), s.id);
        return node.instanceId();
    }

    private void destroy(ManagerSession s, String instanceId) {
        AbstractDataNode node = nodes.remove(instanceId);
        s.nodes.remove(instanceId);
        if (node != null)
            node.expire();
    }

    private ManagerSession session(String sessionId) {
        return sessions.computeIfAbsent(sessionId, ManagerSession::new);
    }

    // ── Wiring ───────────────────────────────────────────────────

    @Override
    public void wire(PdgEdge edge) {
        boolean hostsFrom = nodes.containsKey(edge.from().instanceId());
        boolean hostsTo = nodes.containsKey(edge.to().instanceId());
        if (!hostsFrom && !hostsTo)
            throw new UnknownNodeException("Manager " + managerId + " hosts neither end of " + edge);

        switch (edge.kind()) {
            case PRODUCER_CONSUMER -> wireConsumer(edge, hostsFrom, hostsTo);
            case CONTAINER_CHILD -> wireChild(edge, hostsFrom, hostsTo);
        }
        log.debug("[{}] Wired {}", managerId, edge);
    }

    private void wireConsumer(PdgEdge edge, boolean hostsProducer, boolean hostsConsumer) {
        if (hostsProducer && hostsConsumer) {
            local(edge.from()).addConsumer(local(edge.to()));
        } else if (hostsProducer) {
            AbstractDataNode producer = local(edge.from());
            producer.addConsumerSubscription(remoteSubscriber(edge.to(), producer.channel()));
        } else {
            if (!(local(edge.to()) instanceof ConsumerNode consumer))
                throw new GraphConstructionException("Node " + edge.to() + " cannot consume " + edge.from());
            consumer.addProducer(remote(edge.from()));
        }
    }

    private void wireChild(PdgEdge edge, boolean hostsContainer, boolean hostsChild) {
        if (hostsContainer && hostsChild) {
            container(edge.from()).addChild(local(edge.to()));
        } else if (hostsContainer) {
            container(edge.from()).addRemoteChild(remote(edge.to()));
        } else {
            AbstractDataNode child = local(edge.to());
            child.watch(remoteSubscriber(edge.from(), child.channel()));
        }
    }

    private AbstractDataNode local(NodeRef ref) {
        AbstractDataNode node = nodes.get(ref.instanceId());
        if (node == null)
            throw new UnknownNodeException("Unknown node: " + ref.instanceId());
        return node;
    }

    private ContainerNode container(NodeRef ref) {
        if (!(local(ref) instanceof ContainerNode c))
            throw new GraphConstructionException("Node " + ref + " is not a container");
        return c;
    }

    private DataNode remote(NodeRef ref) {
        return requireDiscovery().resolve(ref.managerId()).lookup(ref.instanceId());
    }

    private RemoteSubscriber remoteSubscriber(NodeRef target, EventChannel channel) {
        return new RemoteSubscriber(target.instanceId(), target.managerId(), dispatcher(), channel);
    }

    private ManagerDiscovery requireDiscovery() {
        ManagerDiscovery d = discovery;
        if (d == null)
            throw new IllegalStateException("Manager " + managerId + " has no discovery attached");
        return d;
    }

    private RemoteEventDispatcher dispatcher() {
        RemoteEventDispatcher d = dispatcher;
        if (d == null) {
            synchronized (this) {
                d = dispatcher;
                if (d == null) {
                    d = new RemoteEventDispatcher(requireDiscovery(), config.getRingBufferSize(),
                            config.getDeliveryMaxAttempts(), config.getDeliveryBackoffMillis());
                    dispatcher = d;
                }
            }
        }
        return d;
    }

    // ── Node access ──────────────────────────────────────────────

    @Override
    public DataNode lookup(String instanceId) {
        return requireNode(instanceId);
    }

    private AbstractDataNode requireNode(String instanceId) {
        AbstractDataNode node = nodes.get(instanceId);
        if (node == null)
            throw new UnknownNodeException("Unknown node: " + instanceId);
        return node;
    }

    @Override
    public NodeInfo describe(String instanceId) {
        AbstractDataNode node = requireNode(instanceId);
        return NodeInfo.of(node, node.kind());
    }

    @Override
    public int write(String instanceId, byte[] data) {
        return requireNode(instanceId).write(data);
    }

    @Override
    public void setCompleted(String instanceId) {
        requireNode(instanceId).setCompleted();
    }

    @Override
    public void fail(String instanceId, String reason) {
        requireNode(instanceId).fail(new DataflowException(reason));
    }

    @Override
    public byte[] readAll(String instanceId) {
        return NodeContents.readAll(requireNode(instanceId));
    }

    /** Live node count, excluding reservations. */
    public int nodeCount() {
        return nodes.size();
    }

    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    /** The session's channel, or null if the session is unknown here. */
    public EventChannel channel(String sessionId) {
        ManagerSession s = sessions.get(sessionId);
        return s == null ? null : s.channel;
    }

    // ── Events & teardown ────────────────────────────────────────

    @Override
    public void deliver(String targetInstanceId, NodeEvent event) {
        AbstractDataNode node = requireNode(targetInstanceId);
        if (!(node instanceof NodeEventListener listener))
            throw new IllegalArgumentException("Node " + targetInstanceId + " does not receive events");
        try {
            inbound[inboundLane(targetInstanceId, inbound.length)].execute(() -> {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("[{}] Handling {} from {} at {} failed", managerId, event.kind(),
                            event.sourceInstanceId(), targetInstanceId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new DeliveryException("Manager " + managerId + " is shutting down", e);
        }
    }

    static int inboundLane(String instanceId, int lanes) {
        return Math.floorMod(instanceId.hashCode(), lanes);
    }

    @Override
    public int shutdownSession(String sessionId) {
        ManagerSession s = sessions.remove(sessionId);
        if (s == null) {
            log.info("[{}] Nothing to tear down for session {}", managerId, sessionId);
            return SHUTDOWN_CLEAN;
        }
        synchronized (capacityLock) {
            reservedSlots -= s.reserved.size();
            s.reserved.clear();
        }
        s.channel.close();

        List<String> interrupted = new ArrayList<>();
        for (AbstractDataNode node : s.nodes.values()) {
            nodes.remove(node.instanceId());
            try {
                if (node.expire() == NodeState.WRITING)
                    interrupted.add(node.instanceId());
            } catch (RuntimeException e) {
                log.warn("[{}] Releasing {} failed: {}", managerId, node.instanceId(), e.getMessage());
            }
        }
        s.nodes.clear();

        if (!interrupted.isEmpty()) {
            log.warn("[{}] Session {} torn down with {} node(s) mid-write: {}", managerId, sessionId,
                    interrupted.size(), interrupted);
            return SHUTDOWN_FORCED;
        }
        log.info("[{}] Session {} torn down", managerId, sessionId);
        return SHUTDOWN_CLEAN;
    }

    /** Tears down every session and stops the manager's threads. */
    @Override
    public void close() {
        for (String sessionId : sessionIds())
            shutdownSession(sessionId);
        for (ExecutorService lane : inbound)
            lane.shutdown();
        try {
            for (ExecutorService lane : inbound) {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS))
                    lane.shutdownNow();
            }
        } catch (InterruptedException e) {
            for (ExecutorService lane : inbound)
                lane.shutdownNow();
            Thread.currentThread().interrupt();
        }
        RemoteEventDispatcher d = dispatcher;
        if (d != null)
            d.close();
        log.info("[{}] Node manager closed", managerId);
    }

    /** Per-session state held by this manager. */
    private static final class ManagerSession {
        final String id;
        final EventChannel channel;
        final Map<String, AbstractDataNode> nodes = new ConcurrentHashMap<>();
        final List<NodeDescriptor> reserved = new ArrayList<>();

        ManagerSession(String id) {
            this.id = id;
            this.channel = new EventChannel(id);
        }
    }
}
