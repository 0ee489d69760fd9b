package com.scidata.dfe.node;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.ChecksumFactory;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.DataStorage;
import com.scidata.dfe.api.EventKind;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeEventListener;
import com.scidata.dfe.api.NodeOutput;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.wiring.EventChannel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A data node that embeds application logic and runs it when its inputs are
 * ready.
 *
 * Trigger Rule:
 * The logic runs exactly once, after every registered producer has published
 * COMPLETE. Duplicate deliveries are ignored and a compare-and-set on the trigger
 * flag keeps concurrent completions from starting the logic twice. A producer
 * ERROR fails this node instead, which cascades to its own consumers.
 *
 * Output:
 * The logic writes through {@link NodeOutput}, i.e. into this node. On normal
 * return the node is completed; an exception from the logic fails it.
 */
public final class ConsumerNode extends AbstractDataNode implements NodeEventListener, NodeOutput {
    private static final Logger log = LogManager.getLogger(ConsumerNode.class);

    private final String appName;
    private final AppLogic logic;
    private final List<DataNode> producers = new CopyOnWriteArrayList<>();
    private final Set<String> completedProducers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean triggered = new AtomicBoolean();

    public ConsumerNode(String objectId, String instanceId, EventChannel channel, DataStorage storage,
            ChecksumFactory checksums, String appName, AppLogic logic) {
        super(objectId, instanceId, channel, storage, checksums, -1);
        this.appName = appName;
        this.logic = logic;
    }

    @Override
    public String kind() {
        return "app:" + appName;
    }

    @Override
    public boolean isContainer() {
        return false;
    }

    public String appName() {
        return appName;
    }

    /**
     * Records a producer whose content this node consumes. Idempotent per
     * producer instance id.
     */
    public void addProducer(DataNode producer) {
        if (triggered.get())
            throw new InvalidStateTransitionException(instanceId(), state(), "add producer to triggered");
        synchronized (producers) {
            for (DataNode p : producers) {
                if (p.instanceId().equals(producer.instanceId()))
                    return;
            }
            producers.add(producer);
        }
    }

    public List<DataNode> producers() {
        return List.copyOf(producers);
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    @Override
    public void onEvent(NodeEvent event) {
        String producerId = event.sourceInstanceId();
        if (!isProducer(producerId)) {
            log.warn("{} ignoring event from non-producer {}", instanceId(), producerId);
            return;
        }
        if (state().isTerminal())
            return;

        if (event.kind() == EventKind.ERROR) {
            fail(new DataflowException("Producer " + producerId + " of " + instanceId() + " failed"));
            return;
        }
        if (!completedProducers.add(producerId))
            return;
        if (completedProducers.size() < producers.size())
            return;
        if (triggered.compareAndSet(false, true))
            runLogic();
    }

    private boolean isProducer(String instanceId) {
        for (DataNode p : producers) {
            if (p.instanceId().equals(instanceId))
                return true;
        }
        return false;
    }

    private void runLogic() {
        List<DataNode> inputs = List.copyOf(producers);
        for (DataNode in : inputs) {
            NodeState s = in.state();
            if (s != NodeState.COMPLETE) {
                fail(new DataflowException("Input " + in.instanceId() + " of " + instanceId() + " is " + s));
                return;
            }
        }
        log.debug("{} running {} on {} input(s)", instanceId(), appName, inputs.size());
        try {
            logic.run(inputs, this);
        } catch (Exception e) {
            log.warn("Application logic {} of {} failed", appName, instanceId(), e);
            fail(e);
            return;
        }
        if (state().isTerminal())
            return;
        try {
            completeInternal();
        } catch (InvalidStateTransitionException e) {
            log.debug("{} completion raced with {}: {}", instanceId(), e.state(), e.getMessage());
        }
    }
}
