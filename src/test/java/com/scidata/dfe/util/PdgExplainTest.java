package com.scidata.dfe.util;

import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.dsl.GraphBuilder;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.PhysicalGraph;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PdgExplainTest {

    private PhysicalGraph pdg;
    private PdgExplain explain;

    @Before
    public void setUp() {
        GraphBuilder g = GraphBuilder.create("explain");
        g.data("in").placement("nm1");
        g.app("crc", AppRegistry.CRC, "in").placement("nm2");
        g.container("all", "crc").placement("nm1");
        g.app("total", AppRegistry.SUM_CHECKSUMS, "all").placement("nm2");
        pdg = g.build("s1", List.of("nm1", "nm2"));
        explain = new PdgExplain(pdg);
    }

    @Test
    public void testDumpTopology() {
        String dump = explain.dumpTopology();
        assertTrue(dump.startsWith("Session s1 (4 nodes):"));
        assertTrue(dump.contains("[0] s1:in @nm1 (ROOT) -> s1:crc"));
        assertTrue(dump.contains("s1:crc @nm2 -> s1:all"));
        // Leaves have no arrow
        assertTrue(dump.contains("s1:total @nm2\n"));
    }

    @Test
    public void testExplainNodeWithoutLiveState() {
        String text = explain.explainNode("s1:crc", null);
        assertTrue(text.contains("Node: s1:crc"));
        assertTrue(text.contains("Type: app:crc"));
        assertTrue(text.contains("Manager: nm2"));
        assertTrue(text.contains("Upstream: s1:in\n"));
        assertTrue(text.contains("Downstream: s1:all (container)\n"));
        assertFalse(text.contains("State:"));
    }

    @Test
    public void testExplainContainerWithLiveState() {
        NodeInfo live = new NodeInfo("s1:all", "all", "s1", "nm1", "container", true, NodeState.COMPLETE, -1, 0,
                0, List.of("s1:total"), List.of());
        String text = explain.explainNode("s1:all", live);
        assertTrue(text.contains("Upstream: s1:crc (child)\n"));
        assertTrue(text.contains("Downstream: s1:total\n"));
        assertTrue(text.contains("State: COMPLETE"));
        assertTrue(text.contains("Bytes: 0\n"));
    }

    @Test
    public void testRootHasNoUpstream() {
        assertTrue(explain.explainNode("s1:in", null).contains("Upstream: -\n"));
    }

    @Test
    public void testMermaidGroupsByManager() {
        String mermaid = explain.toMermaid(Map.of("s1:in", NodeState.COMPLETE));
        assertTrue(mermaid.startsWith("graph LR;"));
        assertTrue(mermaid.contains("subgraph nm1[\"nm1\"]"));
        assertTrue(mermaid.contains("subgraph nm2[\"nm2\"]"));
        assertTrue(mermaid.contains("s1_in[\"in<br/>data:memory<br/><b>COMPLETE</b>\"];"));
        assertTrue(mermaid.contains("s1_all[[\"all<br/>container\"]];"));
        assertTrue(mermaid.contains("s1_in --> s1_crc;"));
        assertTrue(mermaid.contains("s1_crc -. child .-> s1_all;"));
    }
}
