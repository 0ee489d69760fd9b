package com.scidata.dfe.node;

import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.api.ReadHandle;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.exception.NodeFailedException;
import com.scidata.dfe.storage.Checksums;
import com.scidata.dfe.wiring.EventChannel;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class DataObjectNodeTest {

    private EventChannel channel;
    private DataObjectNode node;

    @Before
    public void setUp() {
        channel = new EventChannel("s1");
        node = DataObjectNode.inMemory("obj", "s1:obj", channel);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testFreshNodeIsInitialized() {
        assertEquals(NodeState.INITIALIZED, node.state());
        assertEquals(0, node.bytesWritten());
        assertEquals("s1", node.sessionId());
        assertEquals("data", node.kind());
        assertFalse(node.isContainer());
    }

    @Test
    public void testFirstWriteMovesToWriting() {
        assertEquals(5, node.write(bytes("hello")));
        assertEquals(NodeState.WRITING, node.state());
        assertEquals(5, node.bytesWritten());
    }

    @Test
    public void testSetCompletedFromInitialized() {
        node.setCompleted();
        assertEquals(NodeState.COMPLETE, node.state());
        assertEquals(0, NodeContents.readAll(node).length);
    }

    @Test
    public void testCompleteTwiceIsRejected() {
        node.write(bytes("x"));
        node.setCompleted();
        try {
            node.setCompleted();
            fail("Second completion must be rejected");
        } catch (InvalidStateTransitionException e) {
            assertEquals(NodeState.COMPLETE, e.state());
            assertEquals("s1:obj", e.instanceId());
        }
    }

    @Test
    public void testWriteAfterCompleteFails() {
        node.write(bytes("abc"));
        node.setCompleted();
        try {
            node.write(bytes("more"));
            fail("Write after COMPLETE must fail");
        } catch (InvalidStateTransitionException e) {
            assertEquals(NodeState.COMPLETE, e.state());
        }
        assertEquals(3, node.bytesWritten());
    }

    @Test
    public void testWriteAfterErrorFailsAsInvalidTransition() {
        node.write(bytes("abc"));
        node.fail(new RuntimeException("boom"));
        try {
            node.write(bytes("more"));
            fail("Write after ERROR must fail");
        } catch (InvalidStateTransitionException e) {
            assertTrue(e instanceof NodeFailedException);
        }
    }

    @Test
    public void testReadBeforeCompleteIsRejected() {
        node.write(bytes("abc"));
        try {
            node.open();
            fail("Open before COMPLETE must fail");
        } catch (InvalidStateTransitionException e) {
            assertEquals(NodeState.WRITING, e.state());
        }
    }

    @Test(expected = NodeFailedException.class)
    public void testReadAfterErrorIsRejected() {
        node.fail(new RuntimeException("boom"));
        node.open();
    }

    @Test
    public void testFailIsIgnoredOnTerminalNode() {
        node.setCompleted();
        node.fail(new RuntimeException("late"));
        assertEquals(NodeState.COMPLETE, node.state());
        assertNull(node.failureCause());
    }

    @Test
    public void testFailRecordsCause() {
        RuntimeException cause = new RuntimeException("boom");
        node.fail(cause);
        assertEquals(NodeState.ERROR, node.state());
        assertSame(cause, node.failureCause());
    }

    @Test
    public void testExpectedSizeAutoCompletes() {
        DataObjectNode sized = DataObjectNode.inMemory("obj", "s1:sized", channel, 6);
        sized.write(bytes("abc"));
        assertEquals(NodeState.WRITING, sized.state());
        sized.write(bytes("def"));
        assertEquals(NodeState.COMPLETE, sized.state());
        assertEquals("abcdef", NodeContents.readString(sized));
    }

    @Test
    public void testWriteBeyondExpectedSizeIsAcceptedAndCompletes() {
        DataObjectNode sized = DataObjectNode.inMemory("obj", "s1:sized", channel, 2);
        assertEquals(4, sized.write(bytes("abcd")));
        assertEquals(NodeState.COMPLETE, sized.state());
        assertEquals(4, sized.bytesWritten());
    }

    @Test
    public void testDerivedValueIsIndependentOfChunking() {
        byte[] data = new byte[10_000];
        new Random(42).nextBytes(data);
        long expected = Checksums.crc32(data);

        for (int chunk : new int[] { 1, 7, 512, 4096, data.length }) {
            DataObjectNode n = DataObjectNode.inMemory("obj", "s1:c" + chunk, channel);
            for (int off = 0; off < data.length; off += chunk) {
                int len = Math.min(chunk, data.length - off);
                byte[] part = new byte[len];
                System.arraycopy(data, off, part, 0, len);
                n.write(part);
            }
            n.setCompleted();
            assertEquals("chunk size " + chunk, expected, n.derivedValue());
            assertArrayEquals(data, NodeContents.readAll(n));
        }
    }

    @Test
    public void testStateOnlyMovesForward() {
        List<String> transitions = new ArrayList<>();
        node.setLifecycleListener(new NodeLifecycleListener() {
            @Override
            public void onTransition(String instanceId, NodeState from, NodeState to, long nanoTime) {
                transitions.add(from + "->" + to);
            }

            @Override
            public void onNodeError(String instanceId, Throwable error) {
            }
        });

        node.write(bytes("a"));
        node.write(bytes("b"));
        node.setCompleted();
        node.fail(new RuntimeException("ignored"));
        try {
            node.write(bytes("c"));
        } catch (InvalidStateTransitionException expected) {
            // asserted below
        }
        node.expire();

        assertEquals(List.of("INITIALIZED->WRITING", "WRITING->COMPLETE", "COMPLETE->EXPIRED"), transitions);
    }

    @Test
    public void testExpireReturnsPreviousState() {
        node.write(bytes("abc"));
        assertEquals(NodeState.WRITING, node.expire());
        assertEquals(NodeState.EXPIRED, node.state());
        assertEquals(NodeState.EXPIRED, node.expire());
    }

    @Test
    public void testReadHandlesTrackTheirOwnPosition() {
        node.write(bytes("0123456789"));
        node.setCompleted();

        ReadHandle a = node.open();
        ReadHandle b = node.open();
        assertEquals(2, node.openHandleCount());
        assertEquals("0123", new String(node.read(a, 4), StandardCharsets.UTF_8));
        assertEquals("01", new String(node.read(b, 2), StandardCharsets.UTF_8));
        assertEquals("456789", new String(node.read(a), StandardCharsets.UTF_8));
        assertEquals(0, node.read(a, 10).length);

        a.close();
        node.close(b);
        assertEquals(0, node.openHandleCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClosedHandleCannotRead() {
        node.setCompleted();
        ReadHandle h = node.open();
        h.close();
        node.read(h);
    }

    @Test
    public void testFileBackedNode() throws Exception {
        Path dir = Files.createTempDirectory("dfe-node");
        DataObjectNode file = DataObjectNode.file("obj", "s1:file", channel, dir, -1);
        file.write(bytes("line one\n"));
        file.write(bytes("line two\n"));
        file.setCompleted();

        assertEquals("line one\nline two\n", NodeContents.readString(file));
        assertEquals(List.of("line one\n", "line two\n"), NodeContents.readLines(file));
        assertEquals(Checksums.crc32(bytes("line one\nline two\n")), file.derivedValue());

        file.expire();
        try (var listing = Files.list(dir)) {
            assertEquals(0, listing.count());
        }
    }
}
