package com.scidata.dfe.util;

import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.dsl.TopologicalOrder;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.NodeKind;
import com.scidata.dfe.io.PdgEdge;
import com.scidata.dfe.io.PhysicalGraph;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic renderings of a physical graph.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and logs. Allocates freely; keep it off any
 * event path.
 */
public final class PdgExplain {
    private final PhysicalGraph pdg;

    public PdgExplain(PhysicalGraph pdg) {
        this.pdg = pdg;
    }

    /**
     * Dumps the graph in topological order, one node per line, with its
     * placement and downstream nodes.
     */
    public String dumpTopology() {
        TopologicalOrder topology = pdg.topology();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Session ").append(pdg.sessionId()).append(" (").append(topology.nodeCount())
                .append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            NodeDescriptor d = pdg.node(topology.id(i));
            sb.append("  [").append(i).append("] ").append(d.getInstanceId()).append(" @").append(d.getManagerId());
            if (topology.parentCount(i) == 0)
                sb.append(" (ROOT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.id(topology.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the placement and wiring of a single node, plus its live state when
     * {@code live} is given.
     */
    public String explainNode(String instanceId, NodeInfo live) {
        NodeDescriptor d = pdg.node(instanceId);
        TopologicalOrder topology = pdg.topology();
        int idx = topology.topoIndex(instanceId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(instanceId).append('\n')
                .append("  Object: ").append(d.getObjectId()).append('\n')
                .append("  Type: ").append(typeOf(d)).append('\n')
                .append("  Manager: ").append(d.getManagerId()).append('\n')
                .append("  Topo index: ").append(idx).append('\n');
        sb.append("  Upstream: ");
        appendEnds(sb, instanceId, false);
        sb.append("  Downstream: ");
        appendEnds(sb, instanceId, true);
        if (live != null) {
            sb.append("  State: ").append(live.state()).append('\n')
                    .append("  Bytes: ").append(live.bytesWritten());
            if (live.expectedSize() >= 0)
                sb.append(" / ").append(live.expectedSize());
            sb.append('\n').append("  Checksum: ").append(live.derivedValue()).append('\n');
        }
        return sb.toString();
    }

    private void appendEnds(StringBuilder sb, String instanceId, boolean downstream) {
        boolean first = true;
        for (PdgEdge e : pdg.edges()) {
            String self = downstream ? e.publisher().instanceId() : e.receiver().instanceId();
            if (!self.equals(instanceId))
                continue;
            if (!first)
                sb.append(", ");
            sb.append(downstream ? e.receiver().instanceId() : e.publisher().instanceId());
            if (e.kind() == PdgEdge.Kind.CONTAINER_CHILD)
                sb.append(downstream ? " (container)" : " (child)");
            first = false;
        }
        sb.append(first ? "-" : "").append('\n');
    }

    public String toMermaid() {
        return toMermaid(Map.of());
    }

    /**
     * Generates a Mermaid graph with one subgraph per manager.
     *
     * @param states Optional live states by instance id, shown in node labels.
     */
    public String toMermaid(Map<String, NodeState> states) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        for (Map.Entry<String, List<NodeDescriptor>> group : pdg.byManager().entrySet()) {
            sb.append("  subgraph ").append(sanitize(group.getKey())).append("[\"").append(group.getKey())
                    .append("\"]\n");
            for (NodeDescriptor d : group.getValue()) {
                String label = d.getObjectId() + "<br/>" + typeOf(d);
                NodeState s = states.get(d.getInstanceId());
                if (s != null)
                    label += "<br/><b>" + s + "</b>";
                String open = d.getKind() == NodeKind.CONTAINER ? "[[\"" : "[\"";
                String close = d.getKind() == NodeKind.CONTAINER ? "\"]]" : "\"]";
                sb.append("    ").append(sanitize(d.getInstanceId())).append(open).append(label).append(close)
                        .append(";\n");
            }
            sb.append("  end\n");
        }

        for (PdgEdge e : pdg.edges()) {
            String from = sanitize(e.publisher().instanceId());
            String to = sanitize(e.receiver().instanceId());
            if (e.kind() == PdgEdge.Kind.CONTAINER_CHILD)
                sb.append("  ").append(from).append(" -. child .-> ").append(to).append(";\n");
            else
                sb.append("  ").append(from).append(" --> ").append(to).append(";\n");
        }
        return sb.toString();
    }

    private static String typeOf(NodeDescriptor d) {
        return switch (d.getKind()) {
            case DATA -> "data:" + d.getStorage();
            case CONTAINER -> "container";
            case APP -> "app:" + d.getApp();
        };
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
