package com.scidata.dfe;

import com.scidata.dfe.dsl.GraphBuilder;
import com.scidata.dfe.engine.ExecutionCoordinator;
import com.scidata.dfe.engine.InProcessDiscovery;
import com.scidata.dfe.engine.NodeManager;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.EngineConfig;
import com.scidata.dfe.io.PipelineDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * DFE: push-based dataflow execution engine.
 *
 * <h2>Model</h2>
 * <p>
 * A pipeline is a DAG of data nodes spread over node managers:
 * <ul>
 * <li><b>Data nodes</b> hold bytes written from outside and move through
 * INITIALIZED, WRITING, COMPLETE (or ERROR) and finally EXPIRED.</li>
 * <li><b>Consumer nodes</b> run application logic once all their producers
 * completed, and write its output into themselves.</li>
 * <li><b>Containers</b> complete when all of their children have.</li>
 * </ul>
 * Completion is pushed along the edges as events; nothing polls.
 *
 * <h3>Entry points</h3>
 * <ul>
 * <li>{@link #builder(String)}: declare a pipeline, build its physical graph.</li>
 * <li>{@link #localCluster(int)}: in-process managers sharing one discovery.</li>
 * <li>{@link ExecutionCoordinator#submitPDG}: deploy a graph.</li>
 * </ul>
 */
public final class Dfe {

    private Dfe() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new pipeline builder.
     *
     * @param pipelineName A descriptive name for the pipeline.
     * @return A new {@link GraphBuilder} instance.
     */
    public static GraphBuilder builder(String pipelineName) {
        return GraphBuilder.create(pipelineName);
    }

    /** Builder for a parsed JSON pipeline definition. */
    public static GraphBuilder builder(PipelineDefinition definition) {
        return GraphBuilder.from(definition);
    }

    /**
     * Creates {@code count} managers named {@code nm1..nmN} in this JVM, wired to a
     * shared {@link InProcessDiscovery}.
     */
    public static List<NodeManager> localCluster(int count) {
        return localCluster(count, EngineConfig.load(), new AppRegistry());
    }

    public static List<NodeManager> localCluster(int count, EngineConfig config, AppRegistry apps) {
        InProcessDiscovery discovery = new InProcessDiscovery();
        List<NodeManager> managers = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            NodeManager m = new NodeManager("nm" + i, config, apps);
            discovery.register(m);
            managers.add(m);
        }
        return managers;
    }

    /** Manager ids of a cluster, in order. */
    public static List<String> ids(List<NodeManager> managers) {
        List<String> ids = new ArrayList<>(managers.size());
        for (NodeManager m : managers)
            ids.add(m.managerId());
        return ids;
    }
}
