package com.scidata.dfe.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers events to nodes hosted by other managers.
 *
 * Remote subscribers hand events to this dispatcher instead of calling the remote
 * manager themselves. Events are sequenced through an LMAX Disruptor ring buffer
 * whose single consumer routes each one to a delivery lane owned by the target
 * manager:
 *
 * 1. Non-blocking publication: the publishing node only tries to claim a ring
 * slot. A full ring marks the edge broken instead of stalling the publisher.
 * 2. FIFO per source: the ring is drained in sequence order and every lane is a
 * single thread, so events from one source reach one manager in publish order.
 * 3. Isolation: retries and backoff run on the target manager's lane. A slow or
 * dead manager only holds up deliveries addressed to itself.
 *
 * Retry Policy:
 * Each delivery is attempted up to maxAttempts times with linear backoff. When
 * every attempt fails the edge is marked broken on its channel and the failure is
 * logged; delivery to other subscribers is unaffected.
 */
public final class RemoteEventDispatcher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(RemoteEventDispatcher.class);

    private final ManagerDiscovery discovery;
    private final int maxAttempts;
    private final long backoffMillis;
    private final Disruptor<DeliveryEvent> disruptor;
    private final RingBuffer<DeliveryEvent> ringBuffer;
    private final Map<String, ExecutorService> lanes = new ConcurrentHashMap<>();
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /**
     * @param discovery     Resolves the target manager of each delivery.
     * @param ringSize      Ring buffer size, a power of two.
     * @param maxAttempts   Attempts per delivery, at least 1.
     * @param backoffMillis Base delay between attempts; attempt n waits n times
     *                      this.
     */
    public RemoteEventDispatcher(ManagerDiscovery discovery, int ringSize, int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.discovery = discovery;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;

        // Multiple manager threads may publish concurrently
        this.disruptor = new Disruptor<>(
                DeliveryEvent::new,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new RoutingHandler());
        this.ringBuffer = disruptor.start();
    }

    /**
     * Queues an event for delivery to a node on another manager. Never blocks: when
     * the ring is full the edge is marked broken.
     */
    public void dispatch(NodeEvent event, String targetInstanceId, String targetManagerId, EventChannel channel) {
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            failed.incrementAndGet();
            log.error("Delivery ring full, dropping {} from {} to {}@{}", event.kind(), event.sourceInstanceId(),
                    targetInstanceId, targetManagerId);
            channel.markBroken(event.sourceInstanceId(), targetInstanceId);
            return;
        }
        try {
            ringBuffer.get(sequence).set(event, targetInstanceId, targetManagerId, channel);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /** Remaining free slots; a proxy for backpressure. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /** Managers that have had a delivery lane opened so far. */
    public Set<String> laneIds() {
        return Set.copyOf(lanes.keySet());
    }

    /**
     * Drains pending deliveries (bounded wait) and stops the dispatcher threads.
     */
    @Override
    public void close() {
        try {
            disruptor.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Remote dispatcher did not drain within 5s, halting with pending deliveries");
            disruptor.halt();
        }
        for (ExecutorService lane : lanes.values())
            lane.shutdown();
        for (Map.Entry<String, ExecutorService> lane : lanes.entrySet()) {
            try {
                if (!lane.getValue().awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Delivery lane to {} did not drain within 5s", lane.getKey());
                    lane.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                lane.getValue().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private ExecutorService lane(String managerId) {
        return lanes.computeIfAbsent(managerId, id -> Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "dfe-delivery-" + id);
            t.setDaemon(true);
            return t;
        }));
    }

    private void deliver(Delivery d) {
        try {
            if (attempt(d)) {
                delivered.incrementAndGet();
                return;
            }
            log.error("Giving up delivery of {} from {} to {}@{} after {} attempts", d.event().kind(),
                    d.event().sourceInstanceId(), d.targetInstanceId(), d.targetManagerId(), maxAttempts);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        failed.incrementAndGet();
        d.channel().markBroken(d.event().sourceInstanceId(), d.targetInstanceId());
    }

    private boolean attempt(Delivery d) throws InterruptedException {
        NodeEvent event = d.event();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                discovery.resolve(d.targetManagerId()).deliver(d.targetInstanceId(), event);
                return true;
            } catch (RuntimeException e) {
                errLimiter.log(String.format("Delivery of %s from %s to %s@%s failed (attempt %d/%d): %s",
                        event.kind(), event.sourceInstanceId(), d.targetInstanceId(), d.targetManagerId(),
                        attempt, maxAttempts, e.getMessage()), null);
                if (attempt < maxAttempts)
                    Thread.sleep(backoffMillis * attempt);
            }
        }
        return false;
    }

    /** Immutable copy of a ring slot, handed to a lane. */
    private record Delivery(NodeEvent event, String targetInstanceId, String targetManagerId,
            EventChannel channel) {
    }

    private final class RoutingHandler implements EventHandler<DeliveryEvent> {

        @Override
        public void onEvent(DeliveryEvent slot, long sequence, boolean endOfBatch) {
            Delivery d = new Delivery(slot.event(), slot.targetInstanceId(), slot.targetManagerId(), slot.channel());
            slot.clear();
            try {
                lane(d.targetManagerId()).execute(() -> deliver(d));
            } catch (RejectedExecutionException e) {
                failed.incrementAndGet();
                log.warn("Dispatcher closing, dropping {} from {} to {}", d.event().kind(),
                        d.event().sourceInstanceId(), d.targetInstanceId());
                d.channel().markBroken(d.event().sourceInstanceId(), d.targetInstanceId());
            }
        }
    }
}
