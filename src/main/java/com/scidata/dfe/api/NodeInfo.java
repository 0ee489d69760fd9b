package com.scidata.dfe.api;

import java.util.List;

/**
 * Read-only snapshot of a node, as exchanged with remote callers.
 */
public record NodeInfo(
        String instanceId,
        String objectId,
        String sessionId,
        String managerId,
        String kind,
        boolean container,
        NodeState state,
        long expectedSize,
        long bytesWritten,
        long derivedValue,
        List<String> consumers,
        List<NodeRef> children) {

    public static NodeInfo of(DataNode node, String kind) {
        return new NodeInfo(node.instanceId(), node.objectId(), node.sessionId(), node.managerId(), kind,
                node.isContainer(), node.state(), node.expectedSize(), node.bytesWritten(), node.derivedValue(),
                List.copyOf(node.consumers()), node.children().stream().map(NodeRef::of).toList());
    }
}
