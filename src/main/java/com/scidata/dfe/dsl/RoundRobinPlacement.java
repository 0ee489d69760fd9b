package com.scidata.dfe.dsl;

import com.scidata.dfe.io.PipelineDefinition.StageDef;

import java.util.List;

/**
 * Default placement: a stage's {@code placement} hint wins; everything else is
 * spread over the managers in turn, in declaration order.
 */
public final class RoundRobinPlacement implements PlacementPolicy {

    @Override
    public String assign(StageDef stage, int replica, int ordinal, List<String> managerIds) {
        if (stage.getPlacement() != null)
            return stage.getPlacement();
        return managerIds.get(ordinal % managerIds.size());
    }
}
