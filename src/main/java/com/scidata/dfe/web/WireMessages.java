package com.scidata.dfe.web;

import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.io.NodeDescriptor;

import java.util.List;
import java.util.Set;

/**
 * JSON bodies exchanged between {@link RemoteNodeManager} and
 * {@link NodeManagerServer}.
 */
public final class WireMessages {

    private WireMessages() {
        // Namespace
    }

    public record ManagerStatus(String managerId, int nodes, Set<String> sessions) {
    }

    public record ReserveRequest(List<NodeDescriptor> nodes) {
    }

    public record ReserveResponse(boolean accepted) {
    }

    public record InstanceIds(List<String> instanceIds) {
    }

    public record InstanceId(String instanceId) {
    }

    public record WriteResponse(int accepted) {
    }

    public record FailRequest(String reason) {
    }

    public record ShutdownResponse(int status) {
    }

    /**
     * Error body. {@code type} is the simple name of the engine exception, which
     * the client uses to rethrow the same type.
     */
    public record ErrorResponse(String type, String message, String instanceId, NodeState state) {

        public static ErrorResponse of(Exception e) {
            if (e instanceof InvalidStateTransitionException ist)
                return new ErrorResponse(e.getClass().getSimpleName(), e.getMessage(), ist.instanceId(), ist.state());
            return new ErrorResponse(e.getClass().getSimpleName(), e.getMessage(), null, null);
        }
    }
}
