package com.scidata.dfe.engine;

import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeRef;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.exception.ResourceUnavailableException;
import com.scidata.dfe.exception.UnknownNodeException;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.EngineConfig;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;
import com.scidata.dfe.node.ConsumerNode;
import com.scidata.dfe.util.CompletionTimingListener;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class NodeManagerTest {

    private NodeManager nm;

    @Before
    public void setUp() {
        EngineConfig config = EngineConfig.defaults();
        config.setNodeCapacity(4);
        nm = new NodeManager("nm1", config, new AppRegistry());
        new InProcessDiscovery().register(nm);
    }

    @After
    public void tearDown() {
        nm.close();
    }

    private static NodeDescriptor grep(String iid) {
        NodeDescriptor d = NodeDescriptor.app("grep", iid, AppRegistry.GREP);
        d.setProperties(Map.of("substring", "x"));
        return d;
    }

    @Test
    public void testReserveThenCommitCreatesNodes() {
        assertTrue(nm.reserve("s1", List.of(NodeDescriptor.data("in", "s1:in"), grep("s1:grep"))));
        assertEquals(0, nm.nodeCount());

        assertEquals(List.of("s1:in", "s1:grep"), nm.commit("s1"));
        assertEquals(2, nm.nodeCount());
        assertEquals(NodeState.INITIALIZED, nm.describe("s1:in").state());
        assertTrue(nm.lookup("s1:grep") instanceof ConsumerNode);
        assertEquals("nm1", nm.lookup("s1:in").managerId());
    }

    @Test
    public void testReservationCountsAgainstCapacity() {
        assertTrue(nm.reserve("s1", List.of(NodeDescriptor.data("a", "s1:a"), NodeDescriptor.data("b", "s1:b"),
                NodeDescriptor.data("c", "s1:c"))));
        assertFalse(nm.reserve("s2", List.of(NodeDescriptor.data("d", "s2:d"), NodeDescriptor.data("e", "s2:e"))));

        nm.release("s1");
        assertTrue(nm.reserve("s2", List.of(NodeDescriptor.data("d", "s2:d"), NodeDescriptor.data("e", "s2:e"))));
        assertEquals(List.of("s2:d", "s2:e"), nm.commit("s2"));
    }

    @Test
    public void testReserveDeclinesUnknownApplication() {
        assertFalse(nm.reserve("s1", List.of(NodeDescriptor.app("x", "s1:x", "no-such-app"))));
        assertTrue(nm.sessionIds().isEmpty());
    }

    @Test
    public void testReserveDeclinesExistingInstance() {
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        assertFalse(nm.reserve("s1", List.of(NodeDescriptor.data("a", "s1:a"))));
    }

    @Test(expected = ResourceUnavailableException.class)
    public void testCommitWithoutReservation() {
        nm.commit("s1");
    }

    @Test
    public void testFailedCommitLeavesNothingBehind() {
        NodeDescriptor broken = NodeDescriptor.app("grep", "s1:grep", AppRegistry.GREP);
        assertTrue(nm.reserve("s1", List.of(NodeDescriptor.data("in", "s1:in"), broken)));
        try {
            nm.commit("s1");
            fail("grep without substring cannot be created");
        } catch (GraphConstructionException expected) {
            // rolled back below
        }
        assertEquals(0, nm.nodeCount());
        assertTrue(nm.reserve("s2", List.of(NodeDescriptor.data("a", "s2:a"), NodeDescriptor.data("b", "s2:b"),
                NodeDescriptor.data("c", "s2:c"), NodeDescriptor.data("d", "s2:d"))));
    }

    @Test
    public void testRegisterNodeGeneratesInstanceId() {
        NodeDescriptor d = new NodeDescriptor();
        d.setObjectId("anon");
        String iid = nm.registerNode(d, "s9");
        assertTrue(iid, iid.startsWith("s9:"));
        assertEquals("s9", nm.describe(iid).sessionId());
    }

    @Test(expected = ResourceUnavailableException.class)
    public void testRegisterNodeAtCapacity() {
        for (int i = 0; i < 5; i++)
            nm.registerNode(NodeDescriptor.data("n" + i, "s1:n" + i), "s1");
    }

    @Test
    public void testConcurrentRegistrationsRespectCapacity() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger declined = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                String iid = "s1:n" + i;
                pool.execute(() -> {
                    try {
                        start.await();
                        nm.registerNode(NodeDescriptor.data("n", iid), "s1");
                        accepted.incrementAndGet();
                    } catch (ResourceUnavailableException e) {
                        declined.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(4, accepted.get());
        assertEquals(4, declined.get());
        assertEquals(4, nm.nodeCount());
    }

    @Test
    public void testLocalWiringRunsApplication() {
        nm.registerNode(NodeDescriptor.data("in", "s1:in"), "s1");
        nm.registerNode(grep("s1:grep"), "s1");
        nm.wire(PdgEdge.producerConsumer(new NodeRef("s1:in", "nm1"), new NodeRef("s1:grep", "nm1")));

        nm.write("s1:in", "x marks\nnothing\nbox\n".getBytes(StandardCharsets.UTF_8));
        nm.setCompleted("s1:in");

        NodeInfo info = nm.describe("s1:grep");
        assertEquals(NodeState.COMPLETE, info.state());
        assertEquals("app:grep", info.kind());
        assertEquals("x marks\nbox\n", new String(nm.readAll("s1:grep"), StandardCharsets.UTF_8));
        assertEquals(List.of("s1:grep"), nm.describe("s1:in").consumers());
    }

    @Test
    public void testContainerDescribesChildren() {
        nm.registerNode(NodeDescriptor.container("all", "s1:all"), "s1");
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.wire(PdgEdge.containerChild(new NodeRef("s1:all", "nm1"), new NodeRef("s1:a", "nm1")));

        NodeInfo info = nm.describe("s1:all");
        assertTrue(info.container());
        assertEquals(List.of(new NodeRef("s1:a", "nm1")), info.children());

        nm.setCompleted("s1:a");
        assertEquals(NodeState.COMPLETE, nm.describe("s1:all").state());
    }

    @Test(expected = UnknownNodeException.class)
    public void testWireNeedsOneLocalEnd() {
        nm.wire(PdgEdge.producerConsumer(new NodeRef("s1:x", "nm1"), new NodeRef("s1:y", "nm1")));
    }

    @Test
    public void testInboundDeliveryIsAsynchronous() throws Exception {
        nm.registerNode(NodeDescriptor.container("all", "s1:all"), "s1");
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.wire(PdgEdge.containerChild(new NodeRef("s1:all", "nm1"), new NodeRef("s1:a", "nm1")));

        // Simulates the child's COMPLETE arriving from a peer
        nm.deliver("s1:all", NodeEvent.of("s1:a", "s1", EventKind.COMPLETE));

        long deadline = System.currentTimeMillis() + 5_000;
        while (nm.describe("s1:all").state() != NodeState.COMPLETE) {
            assertTrue("container never completed", System.currentTimeMillis() < deadline);
            Thread.sleep(5);
        }
    }

    @Test
    public void testSlowApplicationDoesNotHoldUpOtherNodes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AppRegistry apps = new AppRegistry().register("blocking", props -> (inputs, out) -> {
            release.await();
            out.write("done");
        });
        NodeManager m = new NodeManager("nm9", EngineConfig.defaults(), apps);
        try {
            String slow = "s1:slow";
            String fast = "s1:fast";
            for (int i = 0; NodeManager.inboundLane(fast, 4) == NodeManager.inboundLane(slow, 4); i++)
                fast = "s1:fast" + i;

            m.registerNode(NodeDescriptor.data("in", "s1:in"), "s1");
            m.registerNode(NodeDescriptor.app("slow", slow, "blocking"), "s1");
            m.registerNode(NodeDescriptor.app("fast", fast, AppRegistry.CRC), "s1");
            // Producers known, no local subscription: the trigger comes through deliver
            ((ConsumerNode) m.lookup(slow)).addProducer(m.lookup("s1:in"));
            ((ConsumerNode) m.lookup(fast)).addProducer(m.lookup("s1:in"));
            m.write("s1:in", "payload".getBytes(StandardCharsets.UTF_8));
            m.setCompleted("s1:in");

            m.deliver(slow, NodeEvent.of("s1:in", "s1", EventKind.COMPLETE));
            m.deliver(fast, NodeEvent.of("s1:in", "s1", EventKind.COMPLETE));

            long deadline = System.currentTimeMillis() + 5_000;
            while (m.describe(fast).state() != NodeState.COMPLETE) {
                assertTrue("fast consumer stuck behind slow one", System.currentTimeMillis() < deadline);
                Thread.sleep(5);
            }
            assertFalse(m.describe(slow).state().isTerminal());

            release.countDown();
            while (m.describe(slow).state() != NodeState.COMPLETE) {
                assertTrue("slow consumer never completed", System.currentTimeMillis() < deadline + 5_000);
                Thread.sleep(5);
            }
        } finally {
            release.countDown();
            m.close();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPlainNodesReceiveNoEvents() {
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.deliver("s1:a", NodeEvent.of("s1:b", "s1", EventKind.COMPLETE));
    }

    @Test
    public void testFailByReason() {
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.fail("s1:a", "operator abort");
        assertEquals(NodeState.ERROR, nm.describe("s1:a").state());
    }

    @Test
    public void testShutdownReportsInterruptedWrites() {
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.registerNode(NodeDescriptor.data("b", "s1:b"), "s1");
        nm.write("s1:a", new byte[] { 1, 2, 3 });
        nm.setCompleted("s1:b");

        assertEquals(NodeManager.SHUTDOWN_FORCED, nm.shutdownSession("s1"));
        assertEquals(0, nm.nodeCount());
        assertNull(nm.channel("s1"));
        assertEquals(NodeManager.SHUTDOWN_CLEAN, nm.shutdownSession("s1"));
    }

    @Test
    public void testShutdownIsCleanWhenNothingIsWriting() {
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.setCompleted("s1:a");
        assertEquals(NodeManager.SHUTDOWN_CLEAN, nm.shutdownSession("s1"));
    }

    @Test
    public void testLifecycleListenersSeeTransitions() {
        CompletionTimingListener timing = new CompletionTimingListener();
        nm.addLifecycleListener(timing);
        nm.registerNode(NodeDescriptor.data("a", "s1:a"), "s1");
        nm.registerNode(NodeDescriptor.data("b", "s1:b"), "s1");

        nm.write("s1:a", new byte[] { 1 });
        nm.setCompleted("s1:a");
        nm.fail("s1:b", "broken");

        assertEquals(1, timing.completedCount());
        assertEquals(1, timing.failedCount());
        assertTrue(timing.dump().contains("Completed"));
    }
}
