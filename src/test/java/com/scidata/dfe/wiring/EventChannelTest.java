package com.scidata.dfe.wiring;

import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.exception.DeliveryException;
import com.scidata.dfe.exception.DuplicateConsumerException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class EventChannelTest {

    private EventChannel channel;
    private List<String> received;

    @Before
    public void setUp() {
        channel = new EventChannel("s1");
        received = new ArrayList<>();
    }

    private void record(String source, String target) {
        channel.subscribe(source, target, e -> received.add(target + "<-" + e.sourceInstanceId() + ":" + e.kind()));
    }

    @Test
    public void testSubscribersNotifiedInRegistrationOrder() {
        record("a", "x");
        record("a", "y");
        record("a", "z");
        record("b", "x");

        NodeEvent e = channel.publish("a", EventKind.COMPLETE);

        assertEquals("a", e.sourceInstanceId());
        assertEquals("s1", e.sessionId());
        assertTrue(e.isComplete());
        assertEquals(List.of("x<-a:COMPLETE", "y<-a:COMPLETE", "z<-a:COMPLETE"), received);
    }

    @Test
    public void testPublishWithoutSubscribersIsHarmless() {
        channel.publish("nobody", EventKind.ERROR);
        assertTrue(received.isEmpty());
    }

    @Test(expected = DuplicateConsumerException.class)
    public void testDuplicateSubscriptionIsRejected() {
        record("a", "x");
        record("a", "x");
    }

    @Test
    public void testFailingSubscriberDoesNotStopFanOut() {
        record("a", "x");
        channel.subscribe("a", "broken", e -> {
            throw new IllegalStateException("handler bug");
        });
        record("a", "z");

        channel.publish("a", EventKind.COMPLETE);

        assertEquals(List.of("x<-a:COMPLETE", "z<-a:COMPLETE"), received);
        assertFalse(channel.isBroken("a", "broken"));
    }

    @Test
    public void testDeliveryFailureMarksEdgeBroken() {
        channel.subscribe("a", new Subscriber() {
            @Override
            public String targetId() {
                return "remote";
            }

            @Override
            public void deliver(NodeEvent event) {
                throw new DeliveryException("unreachable");
            }

            @Override
            public boolean isRemote() {
                return true;
            }
        });
        record("a", "local");

        channel.publish("a", EventKind.COMPLETE);
        channel.publish("a", EventKind.ERROR);

        assertTrue(channel.isBroken("a", "remote"));
        assertEquals(Set.of("a->remote"), channel.brokenEdges());
        assertEquals(List.of("local<-a:COMPLETE", "local<-a:ERROR"), received);
    }

    @Test
    public void testUnsubscribeAndClose() {
        record("a", "x");
        record("b", "y");
        channel.unsubscribeAll("a");
        channel.publish("a", EventKind.COMPLETE);
        channel.publish("b", EventKind.COMPLETE);
        assertEquals(List.of("y<-b:COMPLETE"), received);

        channel.close();
        assertTrue(channel.isClosed());
        channel.publish("b", EventKind.COMPLETE);
        assertEquals(1, received.size());
        assertTrue(channel.subscribers("b").isEmpty());
    }
}
