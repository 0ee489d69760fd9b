package com.scidata.dfe.io;

import com.scidata.dfe.dsl.TopologicalOrder;
import com.scidata.dfe.exception.GraphConstructionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The physical dataflow graph (PDG) of one session: node descriptors with their
 * manager placement, plus the edges between them.
 *
 * Construction validates the graph: unique instance ids, every node placed on a
 * manager, every edge between declared nodes, edge kinds consistent with node
 * kinds, and no cycles.
 */
public final class PhysicalGraph {
    private final String sessionId;
    private final String pipelineName;
    private final Map<String, NodeDescriptor> nodes;
    private final List<PdgEdge> edges;
    private final TopologicalOrder topology;

    public PhysicalGraph(String sessionId, String pipelineName, List<NodeDescriptor> descriptors,
            List<PdgEdge> edges) {
        if (sessionId == null || sessionId.isBlank())
            throw new GraphConstructionException("Session id must not be empty");
        this.sessionId = sessionId;
        this.pipelineName = pipelineName;

        Map<String, NodeDescriptor> byId = new LinkedHashMap<>();
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        for (NodeDescriptor d : descriptors) {
            if (d.getInstanceId() == null)
                throw new GraphConstructionException("Node " + d.getObjectId() + " has no instance id");
            if (d.getManagerId() == null)
                throw new GraphConstructionException("Node " + d.getInstanceId() + " is not placed on a manager");
            if (byId.put(d.getInstanceId(), d) != null)
                throw new GraphConstructionException("Duplicate instance id: " + d.getInstanceId());
            topo.addNode(d.getInstanceId());
        }

        Set<String> seen = new HashSet<>();
        for (PdgEdge e : edges) {
            if (!seen.add(e.kind() + "|" + e.from().instanceId() + "|" + e.to().instanceId()))
                throw new GraphConstructionException("Duplicate edge: " + e);
            NodeDescriptor from = requireNode(byId, e.from().instanceId(), e);
            NodeDescriptor to = requireNode(byId, e.to().instanceId(), e);
            checkPlacement(e, from, to);
            switch (e.kind()) {
                case PRODUCER_CONSUMER -> {
                    if (to.getKind() != NodeKind.APP)
                        throw new GraphConstructionException("Consumer " + to.getInstanceId() + " of " + e
                                + " does not run an application");
                }
                case CONTAINER_CHILD -> {
                    if (from.getKind() != NodeKind.CONTAINER)
                        throw new GraphConstructionException(from.getInstanceId() + " is not a container: " + e);
                }
            }
            topo.addEdge(e.publisher().instanceId(), e.receiver().instanceId());
        }

        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(edges);
        this.topology = topo.build();
    }

    private static NodeDescriptor requireNode(Map<String, NodeDescriptor> byId, String id, PdgEdge e) {
        NodeDescriptor d = byId.get(id);
        if (d == null)
            throw new GraphConstructionException("Edge " + e + " references undeclared node " + id);
        return d;
    }

    private static void checkPlacement(PdgEdge e, NodeDescriptor from, NodeDescriptor to) {
        if (!from.getManagerId().equals(e.from().managerId()) || !to.getManagerId().equals(e.to().managerId()))
            throw new GraphConstructionException("Edge " + e + " disagrees with node placement");
    }

    public String sessionId() {
        return sessionId;
    }

    public String pipelineName() {
        return pipelineName;
    }

    public int size() {
        return nodes.size();
    }

    public NodeDescriptor node(String instanceId) {
        NodeDescriptor d = nodes.get(instanceId);
        if (d == null)
            throw new IllegalArgumentException("Unknown node: " + instanceId);
        return d;
    }

    /** Descriptors in declaration order. */
    public List<NodeDescriptor> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<PdgEdge> edges() {
        return edges;
    }

    public TopologicalOrder topology() {
        return topology;
    }

    /** Managers taking part, in order of first appearance. */
    public Set<String> managerIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (NodeDescriptor d : nodes.values())
            ids.add(d.getManagerId());
        return ids;
    }

    /** Descriptors grouped by manager, each group in declaration order. */
    public Map<String, List<NodeDescriptor>> byManager() {
        Map<String, List<NodeDescriptor>> grouped = new LinkedHashMap<>();
        for (NodeDescriptor d : nodes.values())
            grouped.computeIfAbsent(d.getManagerId(), k -> new ArrayList<>()).add(d);
        return grouped;
    }

    /** Nodes that wait on nothing: data sources and empty containers. */
    public List<String> roots() {
        return topology.roots();
    }

    /** Nodes nothing waits on: the pipeline's final outputs. */
    public List<String> leaves() {
        return topology.leaves();
    }

    @Override
    public String toString() {
        return "PhysicalGraph[" + sessionId + ", " + nodes.size() + " nodes, " + edges.size() + " edges]";
    }
}
