package com.scidata.dfe.api;

/**
 * Observability hook for node lifecycle transitions.
 *
 * Callbacks run on the thread performing the transition, which is frequently the
 * thread cascading completion through the graph. Keep implementations cheap and
 * never block in them.
 */
public interface NodeLifecycleListener {

    /**
     * Called after a node changed state.
     *
     * @param instanceId Node instance id.
     * @param from       Previous state.
     * @param to         New state.
     * @param nanoTime   {@link System#nanoTime()} at the transition.
     */
    void onTransition(String instanceId, NodeState from, NodeState to, long nanoTime);

    /**
     * Called when a node fails.
     *
     * @param instanceId Node instance id.
     * @param error      The cause handed to fail().
     */
    void onNodeError(String instanceId, Throwable error);
}
