package com.scidata.dfe.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.engine.NodeManager;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.DuplicateConsumerException;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.exception.ResourceUnavailableException;
import com.scidata.dfe.exception.UnknownNodeException;
import com.scidata.dfe.io.JsonSupport;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;

import io.javalin.Javalin;
import io.javalin.http.Context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;

/**
 * Exposes a {@link NodeManager} over HTTP/JSON so peers and coordinators in other
 * processes can drive it through {@link RemoteNodeManager}.
 *
 * <p>
 * Routes:
 * <ul>
 * <li>{@code GET /api/manager}: manager id, node count and sessions.</li>
 * <li>{@code POST /api/sessions/{sid}/reserve|release|commit|nodes}: submission.</li>
 * <li>{@code DELETE /api/sessions/{sid}}: session teardown.</li>
 * <li>{@code POST /api/wire}: apply one graph edge.</li>
 * <li>{@code GET /api/nodes/{iid}}, {@code .../content}: node snapshot and bytes.</li>
 * <li>{@code POST /api/nodes/{iid}/write|complete|fail|events}: node operations
 * and inbound event delivery.</li>
 * </ul>
 *
 * <p>
 * Engine exceptions map to status codes: 404 unknown node, 409 illegal state or
 * duplicate consumer, 503 capacity, 400 malformed graph. The body carries the
 * exception type so the client can rethrow it.
 */
public class NodeManagerServer {
    private static final Logger log = LogManager.getLogger(NodeManagerServer.class);
    private static final String JSON = "application/json";

    private final NodeManager manager;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private Javalin app;

    public NodeManagerServer(NodeManager manager) {
        this.manager = manager;
    }

    /**
     * Starts serving.
     *
     * @param port Port to listen on; 0 picks a free one.
     * @return The bound port.
     */
    public int start(int port) {
        app = Javalin.create();
        registerRoutes(app);
        registerErrorMapping(app);
        app.start(port);
        log.info("Node manager {} serving on port {}", manager.managerId(), app.port());
        return app.port();
    }

    public int port() {
        return app.port();
    }

    public URI uri() {
        return URI.create("http://localhost:" + app.port());
    }

    public void stop() {
        if (app != null) {
            app.stop();
            log.info("Node manager {} stopped serving", manager.managerId());
        }
    }

    private void registerRoutes(Javalin app) {
        app.get("/api/manager", ctx -> json(ctx, new WireMessages.ManagerStatus(manager.managerId(),
                manager.nodeCount(), manager.sessionIds())));

        // ── Submission ──
        app.post("/api/sessions/{sid}/reserve", ctx -> {
            var req = mapper.readValue(ctx.body(), WireMessages.ReserveRequest.class);
            json(ctx, new WireMessages.ReserveResponse(manager.reserve(ctx.pathParam("sid"), req.nodes())));
        });
        app.post("/api/sessions/{sid}/release", ctx -> {
            manager.release(ctx.pathParam("sid"));
            ctx.status(204);
        });
        app.post("/api/sessions/{sid}/commit",
                ctx -> json(ctx, new WireMessages.InstanceIds(manager.commit(ctx.pathParam("sid")))));
        app.post("/api/sessions/{sid}/nodes", ctx -> {
            var descriptor = mapper.readValue(ctx.body(), NodeDescriptor.class);
            json(ctx, new WireMessages.InstanceId(manager.registerNode(descriptor, ctx.pathParam("sid"))));
        });
        app.delete("/api/sessions/{sid}",
                ctx -> json(ctx, new WireMessages.ShutdownResponse(manager.shutdownSession(ctx.pathParam("sid")))));
        app.post("/api/wire", ctx -> {
            manager.wire(mapper.readValue(ctx.body(), PdgEdge.class));
            ctx.status(204);
        });

        // ── Nodes ──
        app.get("/api/nodes/{iid}", ctx -> json(ctx, manager.describe(ctx.pathParam("iid"))));
        app.get("/api/nodes/{iid}/content", ctx -> {
            ctx.contentType("application/octet-stream");
            ctx.result(manager.readAll(ctx.pathParam("iid")));
        });
        app.post("/api/nodes/{iid}/write", ctx -> json(ctx,
                new WireMessages.WriteResponse(manager.write(ctx.pathParam("iid"), ctx.bodyAsBytes()))));
        app.post("/api/nodes/{iid}/complete", ctx -> {
            manager.setCompleted(ctx.pathParam("iid"));
            ctx.status(204);
        });
        app.post("/api/nodes/{iid}/fail", ctx -> {
            var req = mapper.readValue(ctx.body(), WireMessages.FailRequest.class);
            manager.fail(ctx.pathParam("iid"), req.reason());
            ctx.status(204);
        });
        app.post("/api/nodes/{iid}/events", ctx -> {
            manager.deliver(ctx.pathParam("iid"), mapper.readValue(ctx.body(), NodeEvent.class));
            ctx.status(202);
        });
    }

    private void registerErrorMapping(Javalin app) {
        app.exception(UnknownNodeException.class, (e, ctx) -> error(ctx, 404, e));
        app.exception(InvalidStateTransitionException.class, (e, ctx) -> error(ctx, 409, e));
        app.exception(DuplicateConsumerException.class, (e, ctx) -> error(ctx, 409, e));
        app.exception(ResourceUnavailableException.class, (e, ctx) -> error(ctx, 503, e));
        app.exception(GraphConstructionException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(IllegalArgumentException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(DataflowException.class, (e, ctx) -> error(ctx, 500, e));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, e);
        });
    }

    private void error(Context ctx, int status, Exception e) {
        log.debug("{} {} -> {}: {}", ctx.method(), ctx.path(), status, e.getMessage());
        try {
            ctx.status(status).contentType(JSON).result(mapper.writeValueAsString(WireMessages.ErrorResponse.of(e)));
        } catch (JsonProcessingException je) {
            ctx.status(status).result(String.valueOf(e.getMessage()));
        }
    }

    private void json(Context ctx, Object body) throws Exception {
        ctx.contentType(JSON).result(mapper.writeValueAsString(body));
    }
}
