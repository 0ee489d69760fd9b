package com.scidata.dfe.engine;

import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeManagerService;
import com.scidata.dfe.api.NodeState;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;
import com.scidata.dfe.io.PhysicalGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * Deploys physical graphs onto node managers and tears them down again.
 *
 * <p>
 * Submission is two-phase and atomic from the caller's point of view:
 * <ol>
 * <li><b>Reserve:</b> every participating manager is asked to reserve capacity
 * for its share. A single decline (or unreachable manager) releases every
 * reservation and the submit fails with nothing created.</li>
 * <li><b>Commit:</b> managers create their nodes, then every edge is wired. A
 * failure here tears the session down on all participants before returning.</li>
 * </ol>
 *
 * <p>
 * Edges are wired receiver side first, so a consumer or container already knows
 * its producer or child by the time the publisher's subscription can replay an
 * event to it.
 *
 * <p>
 * Teardown is best effort: every manager is asked regardless of earlier
 * failures, and the outcome is reported per manager.
 */
@Log4j2
public final class ExecutionCoordinator {
    private static final long POLL_MILLIS = 20;

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final int maxConcurrentSessions;

    public ExecutionCoordinator() {
        this(64);
    }

    public ExecutionCoordinator(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    /**
     * Deploys the graph.
     *
     * @param pdg      The physical graph; its nodes name their managers.
     * @param managers Managers available for the deployment.
     * @return true if every node was created and wired, false if the submission
     *         was declined or rolled back.
     * @throws GraphConstructionException if the graph targets a manager not in
     *                                    {@code managers}.
     */
    public boolean submitPDG(PhysicalGraph pdg, Collection<? extends NodeManagerService> managers) {
        String sessionId = pdg.sessionId();
        Map<String, NodeManagerService> byId = new LinkedHashMap<>();
        for (NodeManagerService m : managers)
            byId.put(m.managerId(), m);
        for (String mid : pdg.managerIds()) {
            if (!byId.containsKey(mid))
                throw new GraphConstructionException("Session " + sessionId + " targets unknown manager " + mid);
        }

        synchronized (sessions) {
            if (sessions.containsKey(sessionId)) {
                log.warn("Session {} is already deployed", sessionId);
                return false;
            }
            if (sessions.size() >= maxConcurrentSessions) {
                log.warn("Rejecting session {}: {} sessions active (limit {})", sessionId, sessions.size(),
                        maxConcurrentSessions);
                return false;
            }
            // Placeholder keeps the slot while the session deploys
            sessions.put(sessionId, SessionRecord.PENDING);
        }

        boolean deployed = false;
        try {
            Map<String, NodeManagerService> participants = new LinkedHashMap<>();
            for (String mid : pdg.managerIds())
                participants.put(mid, byId.get(mid));

            if (!reserveAll(pdg, participants))
                return false;
            if (!commitAll(pdg, participants))
                return false;

            sessions.put(sessionId, new SessionRecord(pdg, participants));
            deployed = true;
            log.info("Session {} deployed: {} nodes, {} edges on {}", sessionId, pdg.size(), pdg.edges().size(),
                    participants.keySet());
            return true;
        } finally {
            if (!deployed)
                sessions.remove(sessionId, SessionRecord.PENDING);
        }
    }

    private boolean reserveAll(PhysicalGraph pdg, Map<String, NodeManagerService> participants) {
        String sessionId = pdg.sessionId();
        Map<String, List<NodeDescriptor>> plan = pdg.byManager();
        List<NodeManagerService> asked = new ArrayList<>();
        for (Map.Entry<String, List<NodeDescriptor>> share : plan.entrySet()) {
            NodeManagerService m = participants.get(share.getKey());
            asked.add(m);
            boolean accepted;
            try {
                accepted = m.reserve(sessionId, share.getValue());
            } catch (RuntimeException e) {
                log.warn("Manager {} failed to reserve for session {}: {}", m.managerId(), sessionId,
                        e.getMessage());
                accepted = false;
            }
            if (!accepted) {
                log.warn("Manager {} declined session {}, releasing {} reservation(s)", m.managerId(), sessionId,
                        asked.size());
                for (NodeManagerService r : asked)
                    releaseQuietly(r, sessionId);
                return false;
            }
        }
        return true;
    }

    private boolean commitAll(PhysicalGraph pdg, Map<String, NodeManagerService> participants) {
        String sessionId = pdg.sessionId();
        try {
            for (NodeManagerService m : participants.values())
                m.commit(sessionId);
            for (PdgEdge e : pdg.edges())
                wire(e, participants);
            return true;
        } catch (RuntimeException e) {
            log.error("Deploying session {} failed, rolling back", sessionId, e);
            for (NodeManagerService m : participants.values()) {
                try {
                    m.shutdownSession(sessionId);
                } catch (RuntimeException re) {
                    log.warn("Rollback of session {} on {} failed: {}", sessionId, m.managerId(), re.getMessage());
                }
            }
            return false;
        }
    }

    private static void wire(PdgEdge e, Map<String, NodeManagerService> participants) {
        String receiver = e.receiver().managerId();
        String publisher = e.publisher().managerId();
        participants.get(receiver).wire(e);
        if (!publisher.equals(receiver))
            participants.get(publisher).wire(e);
    }

    private static void releaseQuietly(NodeManagerService m, String sessionId) {
        try {
            m.release(sessionId);
        } catch (RuntimeException e) {
            log.warn("Releasing session {} on {} failed: {}", sessionId, m.managerId(), e.getMessage());
        }
    }

    /**
     * Tears the session down on every participating manager.
     *
     * @return Per-manager status codes and failures. Empty for an unknown
     *         session.
     */
    public TeardownReport shutdown(String sessionId) {
        SessionRecord record = sessions.get(sessionId);
        if (record == null || record == SessionRecord.PENDING) {
            log.warn("Shutdown requested for unknown session {}", sessionId);
            return TeardownReport.unknown(sessionId);
        }
        sessions.remove(sessionId);

        Map<String, Integer> codes = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (NodeManagerService m : record.managers().values()) {
            try {
                codes.put(m.managerId(), m.shutdownSession(sessionId));
            } catch (RuntimeException e) {
                log.warn("Manager {} could not tear down session {}: {}", m.managerId(), sessionId,
                        e.getMessage());
                failures.put(m.managerId(), String.valueOf(e.getMessage()));
            }
        }
        TeardownReport report = new TeardownReport(sessionId, codes, failures);
        log.info("Session {} shut down (clean={}, partial={})", sessionId, report.isClean(), report.isPartial());
        return report;
    }

    /**
     * Fails every root of the session that has not finished yet. The failures
     * cascade through the graph as ERROR events.
     *
     * @return Number of roots moved to ERROR.
     */
    public int abort(String sessionId) {
        SessionRecord record = requireSession(sessionId);
        int failed = 0;
        for (String root : record.pdg().roots()) {
            NodeManagerService m = record.managerOf(root);
            try {
                if (!m.describe(root).state().isTerminal()) {
                    m.fail(root, "Session " + sessionId + " aborted");
                    failed++;
                }
            } catch (RuntimeException e) {
                log.warn("Aborting {} in session {} failed: {}", root, sessionId, e.getMessage());
            }
        }
        log.info("Session {} aborted: {} root(s) failed", sessionId, failed);
        return failed;
    }

    /**
     * Current state of every node of the session. Nodes whose manager cannot be
     * reached are left out.
     */
    public Map<String, NodeState> sessionStatus(String sessionId) {
        SessionRecord record = requireSession(sessionId);
        Map<String, NodeState> states = new LinkedHashMap<>();
        for (NodeDescriptor d : record.pdg().nodes()) {
            try {
                NodeInfo info = record.managerOf(d.getInstanceId()).describe(d.getInstanceId());
                states.put(d.getInstanceId(), info.state());
            } catch (RuntimeException e) {
                log.debug("No status for {}: {}", d.getInstanceId(), e.getMessage());
            }
        }
        return states;
    }

    /**
     * Waits until every leaf of the session reached COMPLETE or ERROR.
     *
     * @return true if all leaves finished before the timeout.
     */
    public boolean awaitCompletion(String sessionId, long timeout, TimeUnit unit) throws InterruptedException {
        SessionRecord record = requireSession(sessionId);
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        List<String> leaves = record.pdg().leaves();
        while (true) {
            boolean done = true;
            for (String leaf : leaves) {
                NodeState s;
                try {
                    s = record.managerOf(leaf).describe(leaf).state();
                } catch (RuntimeException e) {
                    s = null;
                }
                if (s == null || !s.isTerminal()) {
                    done = false;
                    break;
                }
            }
            if (done)
                return true;
            if (System.nanoTime() >= deadline)
                return false;
            Thread.sleep(POLL_MILLIS);
        }
    }

    public Set<String> activeSessions() {
        Set<String> active = new LinkedHashSet<>();
        sessions.forEach((id, r) -> {
            if (r != SessionRecord.PENDING)
                active.add(id);
        });
        return active;
    }

    public PhysicalGraph graph(String sessionId) {
        return requireSession(sessionId).pdg();
    }

    private SessionRecord requireSession(String sessionId) {
        SessionRecord record = sessions.get(sessionId);
        if (record == null || record == SessionRecord.PENDING)
            throw new DataflowException("Unknown session: " + sessionId);
        return record;
    }

    /** A deployed session: its graph and the managers hosting it. */
    private record SessionRecord(PhysicalGraph pdg, Map<String, NodeManagerService> managers) {
        static final SessionRecord PENDING = new SessionRecord(null, Map.of());

        NodeManagerService managerOf(String instanceId) {
            return managers.get(pdg.node(instanceId).getManagerId());
        }
    }
}
