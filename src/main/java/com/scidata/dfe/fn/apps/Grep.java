package com.scidata.dfe.fn.apps;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.NodeOutput;
import com.scidata.dfe.node.NodeContents;

import java.util.List;

/**
 * Keeps the lines of the input that contain a substring. Lines are written
 * with their terminators, in input order.
 */
public final class Grep implements AppLogic {
    private final String substring;

    public Grep(String substring) {
        this.substring = substring;
    }

    @Override
    public void run(List<DataNode> inputs, NodeOutput output) {
        for (DataNode in : inputs) {
            for (String line : NodeContents.readLines(in)) {
                if (line.contains(substring))
                    output.write(line);
            }
        }
    }
}
