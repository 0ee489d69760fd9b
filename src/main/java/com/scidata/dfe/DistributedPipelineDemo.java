package com.scidata.dfe;

import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.dsl.GraphBuilder;
import com.scidata.dfe.engine.ExecutionCoordinator;
import com.scidata.dfe.engine.NodeManager;
import com.scidata.dfe.engine.TeardownReport;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.EngineConfig;
import com.scidata.dfe.io.PhysicalGraph;
import com.scidata.dfe.util.CompletionTimingListener;
import com.scidata.dfe.util.PdgExplain;
import com.scidata.dfe.web.HttpManagerDiscovery;
import com.scidata.dfe.web.NodeManagerServer;
import com.scidata.dfe.web.RemoteNodeManager;

import lombok.extern.log4j.Log4j2;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs grep, sort and reverse over a few lines of text with the stages split
 * across two node managers that only talk HTTP to each other.
 */
@Log4j2
public class DistributedPipelineDemo {

    private static final String INPUT = "first line\nwe have an a here\nand another one\nnoone knows me";

    public static void main(String[] args) throws Exception {
        log.info("Starting distributed pipeline demo...");
        EngineConfig config = EngineConfig.load();
        AppRegistry apps = new AppRegistry();

        // 1. Two managers, each behind its own server
        NodeManager nm1 = new NodeManager("nm1", config, apps);
        NodeManager nm2 = new NodeManager("nm2", config, apps);
        CompletionTimingListener timing = new CompletionTimingListener();
        nm1.addLifecycleListener(timing);
        nm2.addLifecycleListener(timing);

        NodeManagerServer s1 = new NodeManagerServer(nm1);
        NodeManagerServer s2 = new NodeManagerServer(nm2);
        s1.start(0);
        s2.start(0);

        // 2. Every manager resolves its peers over HTTP
        HttpManagerDiscovery discovery = new HttpManagerDiscovery(config.getRpcTimeoutMillis())
                .register("nm1", s1.uri())
                .register("nm2", s2.uri());
        nm1.attach(discovery);
        nm2.attach(discovery);

        try {
            // 3. Pipeline: input and grep on nm1, sort and reverse on nm2
            GraphBuilder g = Dfe.builder("lines");
            g.data("input").placement("nm1");
            g.app("grep", AppRegistry.GREP, "input").property("substring", "a").placement("nm1");
            g.app("sort", AppRegistry.SORT_LINES, "grep").placement("nm2");
            g.app("reverse", AppRegistry.REVERSE_TOKENS, "sort").placement("nm2");
            PhysicalGraph pdg = g.build("demo", List.of("nm1", "nm2"));
            log.info("\n{}", new PdgExplain(pdg).dumpTopology());

            // 4. Deploy through the remote stubs
            RemoteNodeManager r1 = discovery.stub("nm1");
            RemoteNodeManager r2 = discovery.stub("nm2");
            ExecutionCoordinator coordinator = new ExecutionCoordinator(config.getMaxConcurrentSessions());
            if (!coordinator.submitPDG(pdg, List.of(r1, r2))) {
                log.error("Submission of session demo was declined");
                return;
            }

            // 5. Feed the root and wait for the leaf
            r1.write("demo:input", INPUT.getBytes(StandardCharsets.UTF_8));
            r1.setCompleted("demo:input");
            if (!coordinator.awaitCompletion("demo", 10, TimeUnit.SECONDS))
                log.warn("Session demo did not finish in time");

            Map<String, NodeState> states = coordinator.sessionStatus("demo");
            for (String stage : List.of("grep", "sort", "reverse")) {
                String iid = "demo:" + stage;
                RemoteNodeManager host = discovery.stub(pdg.node(iid).getManagerId());
                log.info("{} [{}]:\n{}", stage, states.get(iid),
                        new String(host.readAll(iid), StandardCharsets.UTF_8));
            }
            log.info("\n{}", new PdgExplain(pdg).toMermaid(states));
            log.info("\n{}", timing.dump());

            TeardownReport report = coordinator.shutdown("demo");
            log.info("Teardown: {}", report);
        } finally {
            discovery.close();
            s1.stop();
            s2.stop();
            nm1.close();
            nm2.close();
        }
    }
}
