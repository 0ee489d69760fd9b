package com.scidata.dfe.api;

import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;

import java.util.List;

/**
 * The node manager surface, identical for in-process managers and remote stubs.
 *
 * Submission is two-phase: {@link #reserve} checks capacity and parks the
 * descriptors, then either {@link #commit} creates the nodes or {@link #release}
 * drops the reservation. Wiring happens after commit.
 */
public interface NodeManagerService {

    String managerId();

    // ── Submission ───────────────────────────────────────────────

    /**
     * Reserves capacity for the given nodes under the session.
     *
     * @return true if the reservation was accepted.
     */
    boolean reserve(String sessionId, List<NodeDescriptor> nodes);

    /** Drops any reservation held for the session. Idempotent. */
    void release(String sessionId);

    /**
     * Creates the nodes reserved for the session.
     *
     * @return Instance ids of the created nodes, in reservation order.
     */
    List<String> commit(String sessionId);

    /** Creates a single node outside of the two-phase protocol. */
    String registerNode(NodeDescriptor descriptor, String sessionId);

    /**
     * Applies one edge of the graph. Each manager applies the side(s) of the edge
     * it hosts: local subscriptions, remote subscriptions, or producer/child
     * proxies.
     */
    void wire(PdgEdge edge);

    // ── Node access ──────────────────────────────────────────────

    /**
     * @throws com.scidata.dfe.exception.UnknownNodeException if the node does
     *                                                         not exist or was
     *                                                         torn down.
     */
    DataNode lookup(String instanceId);

    NodeInfo describe(String instanceId);

    int write(String instanceId, byte[] data);

    void setCompleted(String instanceId);

    void fail(String instanceId, String reason);

    byte[] readAll(String instanceId);

    // ── Events & teardown ────────────────────────────────────────

    /** Delivers an event published on another manager to a node hosted here. */
    void deliver(String targetInstanceId, NodeEvent event);

    /**
     * Destroys every node of the session.
     *
     * @return 0 on a clean teardown, non-zero if any node was mid-write.
     */
    int shutdownSession(String sessionId);
}
