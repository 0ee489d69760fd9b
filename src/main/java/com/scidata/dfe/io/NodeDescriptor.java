package com.scidata.dfe.io;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Everything a node manager needs to create one node of the physical graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NodeDescriptor {
    public static final String STORAGE_MEMORY = "memory";
    public static final String STORAGE_FILE = "file";

    private String objectId, instanceId, managerId;
    private NodeKind kind = NodeKind.DATA;
    private String app;
    private String storage = STORAGE_MEMORY;
    private long expectedSize = -1;
    private Map<String, Object> properties = new LinkedHashMap<>();

    public static NodeDescriptor data(String objectId, String instanceId) {
        return of(NodeKind.DATA, objectId, instanceId);
    }

    public static NodeDescriptor container(String objectId, String instanceId) {
        return of(NodeKind.CONTAINER, objectId, instanceId);
    }

    public static NodeDescriptor app(String objectId, String instanceId, String app) {
        NodeDescriptor d = of(NodeKind.APP, objectId, instanceId);
        d.setApp(app);
        return d;
    }

    private static NodeDescriptor of(NodeKind kind, String objectId, String instanceId) {
        NodeDescriptor d = new NodeDescriptor();
        d.setKind(kind);
        d.setObjectId(objectId);
        d.setInstanceId(instanceId);
        return d;
    }
}
