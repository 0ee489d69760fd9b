package com.scidata.dfe.dsl;

import com.scidata.dfe.api.NodeRef;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.NodeKind;
import com.scidata.dfe.io.PdgEdge;
import com.scidata.dfe.io.PhysicalGraph;
import com.scidata.dfe.io.PipelineDefinition;
import com.scidata.dfe.io.PipelineDefinition.StageDef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph Builder: turns a logical pipeline into a physical graph.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("lines");
 * 2. Declare sources: g.data("input");
 * 3. Declare processing: g.app("grep", "grep", "input").property("substring", "a");
 * 4. Build per session: PhysicalGraph pdg = g.build("s1", List.of("nm1", "nm2"));
 *
 * Expansion Rules:
 * - A stage with n replicas becomes n node instances with the stage name as
 * objectId and instance ids {@code session:stage} (n = 1) or
 * {@code session:stage.i}.
 * - Producer and consumer stages with equal replica counts are wired one to one.
 * A single-replica producer fans out to every consumer replica; a
 * single-replica consumer joins every producer replica. Any other mismatch is
 * rejected.
 * - A container stage takes every instance of each child stage as a child.
 *
 * The builder is reusable: each build call produces an independent graph.
 */
public final class GraphBuilder {
    private final String pipelineName;
    private final Map<String, StageDef> stages = new LinkedHashMap<>();
    private PlacementPolicy placement = new RoundRobinPlacement();

    private GraphBuilder(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public static GraphBuilder create(String pipelineName) {
        return new GraphBuilder(pipelineName);
    }

    /** Builder pre-populated with the stages of a parsed definition. */
    public static GraphBuilder from(PipelineDefinition def) {
        PipelineDefinition.PipelineInfo info = def.getPipeline();
        GraphBuilder g = new GraphBuilder(info.getName());
        for (StageDef s : info.getStages())
            g.register(s);
        return g;
    }

    public String pipelineName() {
        return pipelineName;
    }

    public GraphBuilder placement(PlacementPolicy policy) {
        this.placement = policy;
        return this;
    }

    // ── Stages ──────────────────────────────────────────────────

    /** Declares a data stage, written from outside the engine. */
    public Stage data(String name) {
        StageDef s = new StageDef();
        s.setName(name);
        s.setKind(NodeKind.DATA.name());
        return register(s);
    }

    /**
     * Declares a stage running an application over the given input stages.
     *
     * @param name   Unique stage name.
     * @param app    Registered application name.
     * @param inputs Names of the producer stages, in input order.
     */
    public Stage app(String name, String app, String... inputs) {
        StageDef s = new StageDef();
        s.setName(name);
        s.setKind(NodeKind.APP.name());
        s.setApp(app);
        s.setInputs(List.of(inputs));
        return register(s);
    }

    /** Declares a container completing when every instance of the child stages has. */
    public Stage container(String name, String... children) {
        StageDef s = new StageDef();
        s.setName(name);
        s.setKind(NodeKind.CONTAINER.name());
        s.setChildren(List.of(children));
        return register(s);
    }

    private Stage register(StageDef def) {
        if (def.getName() == null || def.getName().isBlank())
            throw new GraphConstructionException("Stage name must not be empty");
        if (stages.putIfAbsent(def.getName(), def) != null)
            throw new GraphConstructionException("Duplicate stage: " + def.getName());
        return new Stage(def);
    }

    /** The declared stages as a serializable definition. */
    public PipelineDefinition toDefinition() {
        PipelineDefinition.PipelineInfo info = new PipelineDefinition.PipelineInfo();
        info.setName(pipelineName);
        info.setStages(new ArrayList<>(stages.values()));
        PipelineDefinition def = new PipelineDefinition();
        def.setPipeline(info);
        return def;
    }

    // ── Build ───────────────────────────────────────────────────

    /**
     * Expands the pipeline into the physical graph of one session.
     *
     * @param sessionId  Session identifier; prefixes every instance id.
     * @param managerIds Managers available for placement.
     * @throws GraphConstructionException if the pipeline is malformed or cyclic.
     */
    public PhysicalGraph build(String sessionId, List<String> managerIds) {
        if (managerIds == null || managerIds.isEmpty())
            throw new GraphConstructionException("No node managers to place " + pipelineName + " on");
        if (stages.isEmpty())
            throw new GraphConstructionException("Pipeline " + pipelineName + " declares no stages");

        Map<String, NodeKind> kinds = validateStages();

        // 1. Instances, in declaration order
        Map<String, List<NodeRef>> instances = new LinkedHashMap<>();
        List<NodeDescriptor> descriptors = new ArrayList<>();
        int ordinal = 0;
        for (StageDef s : stages.values()) {
            List<NodeRef> refs = new ArrayList<>(s.getReplicas());
            for (int i = 0; i < s.getReplicas(); i++) {
                String managerId = placement.assign(s, i, ordinal++, managerIds);
                if (!managerIds.contains(managerId))
                    throw new GraphConstructionException(
                            "Stage " + s.getName() + " placed on unknown manager " + managerId);
                NodeDescriptor d = descriptor(s, kinds.get(s.getName()), instanceId(sessionId, s, i), managerId);
                descriptors.add(d);
                refs.add(new NodeRef(d.getInstanceId(), managerId));
            }
            instances.put(s.getName(), refs);
        }

        // 2. Edges
        List<PdgEdge> edges = new ArrayList<>();
        for (StageDef s : stages.values()) {
            List<NodeRef> targets = instances.get(s.getName());
            for (String input : nonNull(s.getInputs()))
                connect(instances.get(input), targets, input, s.getName(), edges);
            for (String child : nonNull(s.getChildren())) {
                for (NodeRef c : instances.get(child))
                    edges.add(PdgEdge.containerChild(targets.get(0), c));
            }
        }
        return new PhysicalGraph(sessionId, pipelineName, descriptors, edges);
    }

    /** Checks stage kinds and references; rejects cycles at the stage level. */
    private Map<String, NodeKind> validateStages() {
        Map<String, NodeKind> kinds = new LinkedHashMap<>();
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        for (StageDef s : stages.values()) {
            NodeKind kind;
            try {
                kind = NodeKind.fromString(s.getKind());
            } catch (IllegalArgumentException e) {
                throw new GraphConstructionException("Stage " + s.getName() + ": " + e.getMessage());
            }
            kinds.put(s.getName(), kind);
            topo.addNode(s.getName());

            if (s.getReplicas() < 1)
                throw new GraphConstructionException("Stage " + s.getName() + " needs at least one replica");
            boolean hasInputs = !nonNull(s.getInputs()).isEmpty();
            boolean hasChildren = !nonNull(s.getChildren()).isEmpty();
            switch (kind) {
                case DATA -> {
                    if (hasInputs || hasChildren)
                        throw new GraphConstructionException(
                                "Data stage " + s.getName() + " cannot have inputs or children");
                }
                case APP -> {
                    if (s.getApp() == null)
                        throw new GraphConstructionException("Stage " + s.getName() + " names no application");
                    if (!hasInputs)
                        throw new GraphConstructionException("Application stage " + s.getName() + " has no inputs");
                    if (hasChildren)
                        throw new GraphConstructionException("Application stage " + s.getName()
                                + " cannot have children");
                }
                case CONTAINER -> {
                    if (hasInputs)
                        throw new GraphConstructionException("Container " + s.getName() + " cannot have inputs");
                    if (s.getReplicas() != 1)
                        throw new GraphConstructionException("Container " + s.getName() + " cannot be replicated");
                }
            }
        }

        for (StageDef s : stages.values()) {
            for (String input : distinct(s, "input", s.getInputs()))
                topo.addEdge(requireStage(s, input), s.getName());
            for (String child : distinct(s, "child", s.getChildren()))
                topo.addEdge(requireStage(s, child), s.getName());
        }
        topo.build();
        return kinds;
    }

    private static List<String> distinct(StageDef s, String role, List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : nonNull(names)) {
            if (!seen.add(name))
                throw new GraphConstructionException("Stage " + s.getName() + " names " + role + " " + name
                        + " more than once");
        }
        return nonNull(names);
    }

    private String requireStage(StageDef from, String name) {
        if (!stages.containsKey(name))
            throw new GraphConstructionException("Stage " + from.getName() + " references undeclared stage " + name);
        return name;
    }

    private static void connect(List<NodeRef> producers, List<NodeRef> consumers, String producerStage,
            String consumerStage, List<PdgEdge> edges) {
        int p = producers.size(), c = consumers.size();
        if (p == c) {
            for (int i = 0; i < p; i++)
                edges.add(PdgEdge.producerConsumer(producers.get(i), consumers.get(i)));
        } else if (p == 1) {
            for (NodeRef consumer : consumers)
                edges.add(PdgEdge.producerConsumer(producers.get(0), consumer));
        } else if (c == 1) {
            for (NodeRef producer : producers)
                edges.add(PdgEdge.producerConsumer(producer, consumers.get(0)));
        } else {
            throw new GraphConstructionException("Cannot wire " + p + " replicas of " + producerStage + " to " + c
                    + " replicas of " + consumerStage);
        }
    }

    private static NodeDescriptor descriptor(StageDef s, NodeKind kind, String instanceId, String managerId) {
        NodeDescriptor d = new NodeDescriptor();
        d.setObjectId(s.getName());
        d.setInstanceId(instanceId);
        d.setManagerId(managerId);
        d.setKind(kind);
        d.setApp(s.getApp());
        if (s.getStorage() != null)
            d.setStorage(s.getStorage());
        d.setExpectedSize(s.getExpectedSize());
        if (s.getProperties() != null)
            d.setProperties(new LinkedHashMap<>(s.getProperties()));
        return d;
    }

    static String instanceId(String sessionId, StageDef s, int replica) {
        return s.getReplicas() == 1 ? sessionId + ":" + s.getName() : sessionId + ":" + s.getName() + "." + replica;
    }

    private static List<String> nonNull(List<String> list) {
        return list == null ? List.of() : list;
    }

    /** Fluent handle for tuning a declared stage. */
    public static final class Stage {
        private final StageDef def;

        private Stage(StageDef def) {
            this.def = def;
        }

        public String name() {
            return def.getName();
        }

        public Stage replicas(int replicas) {
            def.setReplicas(replicas);
            return this;
        }

        /** {@code memory} (default) or {@code file}. */
        public Stage storage(String storage) {
            def.setStorage(storage);
            return this;
        }

        public Stage expectedSize(long bytes) {
            def.setExpectedSize(bytes);
            return this;
        }

        /** Pins every instance of the stage to a manager. */
        public Stage placement(String managerId) {
            def.setPlacement(managerId);
            return this;
        }

        public Stage property(String key, Object value) {
            if (def.getProperties() == null)
                def.setProperties(new LinkedHashMap<>());
            def.getProperties().put(key, value);
            return this;
        }

        public Stage description(String description) {
            def.setDescription(description);
            return this;
        }
    }
}
