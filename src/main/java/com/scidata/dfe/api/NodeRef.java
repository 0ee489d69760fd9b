package com.scidata.dfe.api;

/**
 * Addresses a node across managers: its instance id plus the id of the manager
 * hosting it. A null managerId means "same manager as the referrer".
 */
public record NodeRef(String instanceId, String managerId) {

    public static NodeRef of(DataNode node) {
        return new NodeRef(node.instanceId(), node.managerId());
    }

    @Override
    public String toString() {
        return managerId == null ? instanceId : instanceId + "@" + managerId;
    }
}
