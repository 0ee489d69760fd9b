package com.scidata.dfe.dsl;

import com.scidata.dfe.exception.GraphConstructionException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
        assertTrue(order.roots().isEmpty());
    }

    @Test
    public void testLinearGraph() {
        // C is declared first but must come last
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("C").addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(List.of("A", "B", "C"), order.ids());
        assertEquals(0, order.topoIndex("A"));
        assertEquals(1, order.childCount(0));
        assertEquals("B", order.id(order.child(0, 0)));
        assertEquals(1, order.parentCount(order.topoIndex("C")));
        assertEquals(List.of("A"), order.roots());
        assertEquals(List.of("C"), order.leaves());
    }

    @Test
    public void testDiamond() {
        // A -> B, A -> C, B -> D, C -> D
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B").addEdge("A", "C")
                .addEdge("B", "D").addEdge("C", "D")
                .build();

        assertEquals(0, order.topoIndex("A"));
        assertEquals(3, order.topoIndex("D"));
        assertEquals(2, order.parentCount(3));
        assertEquals(2, order.childCount(0));
    }

    @Test
    public void testCycleIsReportedWithItsMembers() {
        try {
            TopologicalOrder.builder()
                    .addNode("root").addNode("A").addNode("B").addNode("C")
                    .addEdge("root", "A")
                    .addEdge("A", "B").addEdge("B", "C").addEdge("C", "A")
                    .build();
            fail("Cycle must be rejected");
        } catch (GraphConstructionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("[A, B, C]"));
        }
    }

    @Test(expected = GraphConstructionException.class)
    public void testSelfEdge() {
        TopologicalOrder.builder().addNode("A").addEdge("A", "A");
    }

    @Test(expected = GraphConstructionException.class)
    public void testUnknownNode() {
        TopologicalOrder.builder().addNode("A").addEdge("A", "B");
    }

    @Test(expected = GraphConstructionException.class)
    public void testDuplicateNode() {
        TopologicalOrder.builder().addNode("A").addNode("A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLookup() {
        TopologicalOrder.builder().addNode("A").build().topoIndex("B");
    }
}
