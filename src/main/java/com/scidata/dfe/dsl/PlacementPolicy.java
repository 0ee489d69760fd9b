package com.scidata.dfe.dsl;

import com.scidata.dfe.io.PipelineDefinition.StageDef;

import java.util.List;

/**
 * Decides which node manager hosts each instance of a stage.
 */
@FunctionalInterface
public interface PlacementPolicy {

    /**
     * @param stage      The stage being expanded.
     * @param replica    Replica index within the stage, 0-based.
     * @param ordinal    Index of the instance across the whole graph, in
     *                   declaration order.
     * @param managerIds Candidate managers, never empty.
     * @return One of {@code managerIds}.
     */
    String assign(StageDef stage, int replica, int ordinal, List<String> managerIds);

    /** Places everything on one manager. */
    static PlacementPolicy pinned(String managerId) {
        return (stage, replica, ordinal, managerIds) -> managerId;
    }
}
