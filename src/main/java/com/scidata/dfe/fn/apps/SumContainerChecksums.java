package com.scidata.dfe.fn.apps;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.NodeOutput;

import java.util.List;

/**
 * Sums the checksums of every leaf under the input containers and writes the
 * total as a decimal string. Nested containers are descended into.
 */
public final class SumContainerChecksums implements AppLogic {

    @Override
    public void run(List<DataNode> inputs, NodeOutput output) {
        long total = 0;
        for (DataNode in : inputs) {
            if (!in.isContainer())
                throw new IllegalArgumentException(
                        "sum-checksums consumes container nodes only, got " + in.instanceId());
            total += sum(in);
        }
        output.write(Long.toString(total));
    }

    static long sum(DataNode container) {
        long total = 0;
        for (DataNode child : container.children())
            total += child.isContainer() ? sum(child) : child.derivedValue();
        return total;
    }
}
