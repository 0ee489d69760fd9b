package com.scidata.dfe.exception;

import com.scidata.dfe.api.NodeState;

/**
 * An operation was attempted on a node already in ERROR.
 *
 * Extends InvalidStateTransitionException because any operation on a failed node
 * is also an illegal transition; callers that only care about state legality can
 * catch the parent.
 */
public class NodeFailedException extends InvalidStateTransitionException {

    public NodeFailedException(String instanceId, String operation) {
        super(instanceId, NodeState.ERROR, operation);
    }

    private NodeFailedException(String instanceId, String message, Throwable cause) {
        super(instanceId, NodeState.ERROR, message, cause);
    }

    public static NodeFailedException remote(String instanceId, String message) {
        return new NodeFailedException(instanceId, message, null);
    }
}
