package com.scidata.dfe.fn.apps;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.NodeOutput;
import com.scidata.dfe.node.NodeContents;
import com.scidata.dfe.storage.Checksums;

import java.util.List;

/**
 * Writes the decimal CRC-32 of each input's content, in input order.
 *
 * The input is streamed in chunks, so the result does not depend on the input
 * size fitting in memory.
 */
public final class CrcResult implements AppLogic {

    @Override
    public void run(List<DataNode> inputs, NodeOutput output) {
        for (DataNode in : inputs)
            output.write(Long.toString(NodeContents.checksum(in, Checksums.CRC_32)));
    }
}
