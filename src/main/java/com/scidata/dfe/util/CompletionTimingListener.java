package com.scidata.dfe.util;

import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeState;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks how long nodes take from their first write to completion.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average WRITING to COMPLETE time.</li>
 * <li><b>Outcomes:</b> number of nodes completed and failed.</li>
 * </ul>
 *
 * <p>
 * Nodes that complete straight from INITIALIZED (joins, empty outputs) count as
 * completed with zero latency.
 */
public final class CompletionTimingListener implements NodeLifecycleListener {
    private static final Logger log = LogManager.getLogger(CompletionTimingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Map<String, Long> writeStarts = new ConcurrentHashMap<>();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();
    private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxNanos = new AtomicLong(Long.MIN_VALUE);

    @Override
    public void onTransition(String instanceId, NodeState from, NodeState to, long nanoTime) {
        if (to == NodeState.WRITING) {
            writeStarts.put(instanceId, nanoTime);
        } else if (to == NodeState.COMPLETE) {
            Long start = writeStarts.remove(instanceId);
            long latency = start == null ? 0 : nanoTime - start;
            completed.incrementAndGet();
            totalNanos.addAndGet(latency);
            minNanos.accumulateAndGet(latency, Math::min);
            maxNanos.accumulateAndGet(latency, Math::max);
        } else if (to == NodeState.EXPIRED || to == NodeState.ERROR) {
            writeStarts.remove(instanceId);
        }
    }

    @Override
    public void onNodeError(String instanceId, Throwable error) {
        failed.incrementAndGet();
        errLimiter.log(String.format("Node '%s' failed: %s", instanceId,
                error == null ? "unknown cause" : error.getMessage()), null);
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public double avgLatencyMicros() {
        long n = completed.get();
        return n > 0 ? totalNanos.get() / 1000.0 / n : 0;
    }

    public long minLatencyNanos() {
        long v = minNanos.get();
        return v == Long.MAX_VALUE ? 0 : v;
    }

    public long maxLatencyNanos() {
        long v = maxNanos.get();
        return v == Long.MIN_VALUE ? 0 : v;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s%n", "Metric", "Count", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("-------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10.2f | %10.2f | %10.2f%n", "Completed", completedCount(),
                avgLatencyMicros(), minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-12s | %10d |%n", "Failed", failedCount()));
        return sb.toString();
    }
}
