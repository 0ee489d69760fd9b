package com.scidata.dfe.util;

import com.scidata.dfe.api.NodeLifecycleListener;
import com.scidata.dfe.api.NodeState;

import java.util.Arrays;

/**
 * Aggregates multiple {@link NodeLifecycleListener} instances. Registration
 * copies the array, so iteration needs no lock.
 */
public class CompositeLifecycleListener implements NodeLifecycleListener {
    private volatile NodeLifecycleListener[] listeners = new NodeLifecycleListener[0];

    public synchronized void addForComposite(NodeLifecycleListener listener) {
        NodeLifecycleListener[] old = listeners;
        NodeLifecycleListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onTransition(String instanceId, NodeState from, NodeState to, long nanoTime) {
        for (NodeLifecycleListener l : listeners)
            l.onTransition(instanceId, from, to, nanoTime);
    }

    @Override
    public void onNodeError(String instanceId, Throwable error) {
        for (NodeLifecycleListener l : listeners)
            l.onNodeError(instanceId, error);
    }
}
