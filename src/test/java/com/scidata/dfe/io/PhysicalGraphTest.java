package com.scidata.dfe.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidata.dfe.api.NodeRef;
import com.scidata.dfe.exception.GraphConstructionException;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PhysicalGraphTest {

    private static NodeDescriptor placed(NodeDescriptor d, String managerId) {
        d.setManagerId(managerId);
        return d;
    }

    @Test
    public void testContainerEdgesPointFromChildInTopology() {
        NodeDescriptor a = placed(NodeDescriptor.data("a", "s:a"), "nm1");
        NodeDescriptor c = placed(NodeDescriptor.container("c", "s:c"), "nm2");
        PhysicalGraph pdg = new PhysicalGraph("s", "p", List.of(c, a),
                List.of(PdgEdge.containerChild(new NodeRef("s:c", "nm2"), new NodeRef("s:a", "nm1"))));

        assertEquals(List.of("s:a", "s:c"), pdg.topology().ids());
        assertEquals(List.of("s:a"), pdg.roots());
        assertEquals(List.of("nm2", "nm1"), List.copyOf(pdg.managerIds()));
        assertTrue(pdg.edges().get(0).crossesManagers());
        assertEquals("s:a", pdg.edges().get(0).publisher().instanceId());
    }

    @Test(expected = GraphConstructionException.class)
    public void testConsumerMustBeApplication() {
        NodeDescriptor a = placed(NodeDescriptor.data("a", "s:a"), "nm1");
        NodeDescriptor b = placed(NodeDescriptor.data("b", "s:b"), "nm1");
        new PhysicalGraph("s", "p", List.of(a, b),
                List.of(PdgEdge.producerConsumer(new NodeRef("s:a", "nm1"), new NodeRef("s:b", "nm1"))));
    }

    @Test(expected = GraphConstructionException.class)
    public void testEdgeMustAgreeWithPlacement() {
        NodeDescriptor a = placed(NodeDescriptor.data("a", "s:a"), "nm1");
        NodeDescriptor b = placed(NodeDescriptor.app("b", "s:b", "crc"), "nm1");
        new PhysicalGraph("s", "p", List.of(a, b),
                List.of(PdgEdge.producerConsumer(new NodeRef("s:a", "nm2"), new NodeRef("s:b", "nm1"))));
    }

    @Test(expected = GraphConstructionException.class)
    public void testDuplicateChildEdge() {
        NodeDescriptor a = placed(NodeDescriptor.data("a", "s:a"), "nm1");
        NodeDescriptor c = placed(NodeDescriptor.container("c", "s:c"), "nm1");
        PdgEdge edge = PdgEdge.containerChild(new NodeRef("s:c", "nm1"), new NodeRef("s:a", "nm1"));
        new PhysicalGraph("s", "p", List.of(a, c), List.of(edge, edge));
    }

    @Test(expected = GraphConstructionException.class)
    public void testDuplicateConsumerEdge() {
        NodeDescriptor a = placed(NodeDescriptor.data("a", "s:a"), "nm1");
        NodeDescriptor b = placed(NodeDescriptor.app("b", "s:b", "crc"), "nm2");
        new PhysicalGraph("s", "p", List.of(a, b),
                List.of(PdgEdge.producerConsumer(new NodeRef("s:a", "nm1"), new NodeRef("s:b", "nm2")),
                        PdgEdge.producerConsumer(new NodeRef("s:a", "nm1"), new NodeRef("s:b", "nm2"))));
    }

    @Test(expected = GraphConstructionException.class)
    public void testUnplacedNode() {
        new PhysicalGraph("s", "p", List.of(NodeDescriptor.data("a", "s:a")), List.of());
    }

    @Test(expected = GraphConstructionException.class)
    public void testDuplicateInstance() {
        new PhysicalGraph("s", "p", List.of(placed(NodeDescriptor.data("a", "s:a"), "nm1"),
                placed(NodeDescriptor.data("a", "s:a"), "nm1")), List.of());
    }

    @Test
    public void testWireTypesSurviveJson() throws Exception {
        ObjectMapper mapper = JsonSupport.newMapper();
        PdgEdge edge = PdgEdge.producerConsumer(new NodeRef("s:a", "nm1"), new NodeRef("s:b", "nm2"));
        assertEquals(edge, mapper.readValue(mapper.writeValueAsString(edge), PdgEdge.class));

        NodeDescriptor d = placed(NodeDescriptor.app("grep", "s:grep", "grep"), "nm1");
        d.setProperties(new LinkedHashMap<>(Map.of("substring", "a")));
        NodeDescriptor back = mapper.readValue(mapper.writeValueAsString(d), NodeDescriptor.class);
        assertEquals(d, back);
        assertEquals(NodeKind.APP, back.getKind());
    }
}
