package com.scidata.dfe.exception;

import com.scidata.dfe.api.NodeState;

/**
 * An operation is illegal for the node's current state, e.g. a write after
 * COMPLETE.
 */
public class InvalidStateTransitionException extends DataflowException {
    private final String instanceId;
    private final NodeState state;

    public InvalidStateTransitionException(String instanceId, NodeState state, String operation) {
        super("Cannot " + operation + " node " + instanceId + " in state " + state);
        this.instanceId = instanceId;
        this.state = state;
    }

    /** Rebuilds an error reported by a remote manager, keeping its message. */
    protected InvalidStateTransitionException(String instanceId, NodeState state, String message, Throwable cause) {
        super(message, cause);
        this.instanceId = instanceId;
        this.state = state;
    }

    public static InvalidStateTransitionException remote(String instanceId, NodeState state, String message) {
        return new InvalidStateTransitionException(instanceId, state, message, null);
    }

    public String instanceId() {
        return instanceId;
    }

    public NodeState state() {
        return state;
    }
}
