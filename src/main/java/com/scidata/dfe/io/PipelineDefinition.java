package com.scidata.dfe.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a logical pipeline, as read from JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineDefinition {
    private PipelineInfo pipeline;

    /** Meta-information about the pipeline. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class PipelineInfo {
        private String name, version;
        private List<StageDef> stages;
    }

    /**
     * Definition of one stage. A stage expands into {@code replicas} node
     * instances of the physical graph.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class StageDef {
        private String name, kind, app, storage, placement, description;
        private int replicas = 1;
        private long expectedSize = -1;
        private List<String> inputs;
        private List<String> children;
        private Map<String, Object> properties;
    }
}
