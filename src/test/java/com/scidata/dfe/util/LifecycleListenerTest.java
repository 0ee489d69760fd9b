package com.scidata.dfe.util;

import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeState;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class LifecycleListenerTest {

    @Test
    public void testTimingMeasuresWriteToComplete() {
        CompletionTimingListener timing = new CompletionTimingListener();
        timing.onTransition("s1:a", NodeState.INITIALIZED, NodeState.WRITING, 1_000);
        timing.onTransition("s1:a", NodeState.WRITING, NodeState.COMPLETE, 5_000);
        timing.onTransition("s1:b", NodeState.INITIALIZED, NodeState.WRITING, 1_000);
        timing.onTransition("s1:b", NodeState.WRITING, NodeState.COMPLETE, 3_000);

        assertEquals(2, timing.completedCount());
        assertEquals(2_000, timing.minLatencyNanos());
        assertEquals(4_000, timing.maxLatencyNanos());
        assertEquals(3.0, timing.avgLatencyMicros(), 1e-9);
    }

    @Test
    public void testCompletionWithoutWritesHasZeroLatency() {
        // Containers go straight from INITIALIZED to COMPLETE
        CompletionTimingListener timing = new CompletionTimingListener();
        timing.onTransition("s1:all", NodeState.INITIALIZED, NodeState.COMPLETE, 9_000);
        assertEquals(1, timing.completedCount());
        assertEquals(0, timing.maxLatencyNanos());
    }

    @Test
    public void testFailuresAreCounted() {
        CompletionTimingListener timing = new CompletionTimingListener();
        timing.onTransition("s1:a", NodeState.INITIALIZED, NodeState.WRITING, 1_000);
        timing.onTransition("s1:a", NodeState.WRITING, NodeState.ERROR, 2_000);
        timing.onNodeError("s1:a", new IllegalStateException("boom"));

        assertEquals(0, timing.completedCount());
        assertEquals(1, timing.failedCount());
        assertEquals(0.0, timing.avgLatencyMicros(), 0.0);
        assertTrue(timing.dump().contains("Failed"));
    }

    @Test
    public void testCompositeFansOut() {
        List<String> seen = new ArrayList<>();
        CompositeLifecycleListener composite = new CompositeLifecycleListener();
        composite.addForComposite(recorder("first", seen));
        composite.addForComposite(recorder("second", seen));
        assertEquals(2, composite.size());

        composite.onTransition("s1:a", NodeState.INITIALIZED, NodeState.WRITING, 0);
        composite.onNodeError("s1:a", null);
        assertEquals(List.of("first:WRITING", "second:WRITING", "first:error", "second:error"), seen);
    }

    private static NodeLifecycleListener recorder(String name, List<String> seen) {
        return new NodeLifecycleListener() {
            @Override
            public void onTransition(String instanceId, NodeState from, NodeState to, long nanoTime) {
                seen.add(name + ":" + to);
            }

            @Override
            public void onNodeError(String instanceId, Throwable error) {
                seen.add(name + ":error");
            }
        };
    }

    @Test
    public void testRateLimiterSuppressesBursts() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(LifecycleListenerTest.class), 60_000);
        limiter.log("delivery failed", null);
        for (int i = 0; i < 5; i++)
            limiter.log("delivery failed", null);
        assertEquals(5, limiter.suppressedCount());
    }
}
