package com.scidata.dfe.api;

import java.util.List;

/**
 * A unit of application logic embedded in a consumer node.
 *
 * The engine invokes {@link #run} once, after every input is COMPLETE, on the
 * thread that delivered the last completion event. When run returns normally the
 * consumer node is completed; when it throws, the consumer node fails and the
 * error propagates downstream.
 */
@FunctionalInterface
public interface AppLogic {

    /**
     * @param inputs Producer nodes, in wiring order. All are COMPLETE.
     * @param output Where results are written.
     * @throws Exception Any failure. Converted into the consumer's ERROR state.
     */
    void run(List<DataNode> inputs, NodeOutput output) throws Exception;
}
