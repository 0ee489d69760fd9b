package com.scidata.dfe.fn.apps;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.NodeOutput;
import com.scidata.dfe.node.NodeContents;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts the lines of all inputs together, in natural string order. Each line
 * keeps its terminator.
 */
public final class SortLines implements AppLogic {
    private final boolean descending;

    public SortLines(boolean descending) {
        this.descending = descending;
    }

    @Override
    public void run(List<DataNode> inputs, NodeOutput output) {
        List<String> lines = new ArrayList<>();
        for (DataNode in : inputs)
            lines.addAll(NodeContents.readLines(in));
        lines.sort(descending ? Comparator.reverseOrder() : Comparator.naturalOrder());
        for (String line : lines)
            output.write(line);
    }
}
