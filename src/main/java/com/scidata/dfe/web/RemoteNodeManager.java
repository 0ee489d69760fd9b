package com.scidata.dfe.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeEvent;
import com.scidata.dfe.api.NodeInfo;
import com.scidata.dfe.api.NodeManagerService;
import com.scidata.dfe.exception.DataflowException;
import com.scidata.dfe.exception.DeliveryException;
import com.scidata.dfe.exception.DuplicateConsumerException;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.exception.InvalidStateTransitionException;
import com.scidata.dfe.exception.NodeFailedException;
import com.scidata.dfe.exception.ResourceUnavailableException;
import com.scidata.dfe.exception.UnknownNodeException;
import com.scidata.dfe.io.JsonSupport;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.io.PdgEdge;

import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Client stub for a {@link NodeManagerServer} in another process.
 *
 * Every call is a blocking HTTP request with the configured timeout. Error
 * responses are turned back into the engine exception the server raised;
 * transport failures surface as {@link DeliveryException}.
 */
public class RemoteNodeManager implements NodeManagerService, Closeable {
    private static final Logger log = LogManager.getLogger(RemoteNodeManager.class);

    private final String managerId;
    private final URI baseUri;
    private final CloseableHttpClient http;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private volatile ManagerDiscovery discovery;

    /**
     * @param managerId     Id of the remote manager.
     * @param baseUri       Server root, e.g. {@code http://host:7000}.
     * @param timeoutMillis Connect, socket and pool timeout per request.
     */
    public RemoteNodeManager(String managerId, URI baseUri, int timeoutMillis) {
        this.managerId = managerId;
        this.baseUri = baseUri;
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .build();
        this.http = HttpClientBuilder.create()
                .setConnectionManager(new PoolingHttpClientConnectionManager())
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    /** Discovery used by proxies to reach children hosted elsewhere. */
    void attach(ManagerDiscovery discovery) {
        this.discovery = discovery;
    }

    ManagerDiscovery discovery() {
        return discovery;
    }

    @Override
    public String managerId() {
        return managerId;
    }

    public URI baseUri() {
        return baseUri;
    }

    // ── Submission ───────────────────────────────────────────────

    @Override
    public boolean reserve(String sessionId, List<NodeDescriptor> nodes) {
        HttpPost post = post(session(sessionId) + "/reserve", new WireMessages.ReserveRequest(nodes));
        return execute(post, WireMessages.ReserveResponse.class).accepted();
    }

    @Override
    public void release(String sessionId) {
        execute(new HttpPost(uri(session(sessionId) + "/release")), null);
    }

    @Override
    public List<String> commit(String sessionId) {
        return execute(new HttpPost(uri(session(sessionId) + "/commit")), WireMessages.InstanceIds.class)
                .instanceIds();
    }

    @Override
    public String registerNode(NodeDescriptor descriptor, String sessionId) {
        return execute(post(session(sessionId) + "/nodes", descriptor), WireMessages.InstanceId.class).instanceId();
    }

    @Override
    public void wire(PdgEdge edge) {
        execute(post("/api/wire", edge), null);
    }

    // ── Node access ──────────────────────────────────────────────

    /** Returns a proxy after checking that the node exists. */
    @Override
    public DataNode lookup(String instanceId) {
        return new RemoteNodeProxy(this, describe(instanceId));
    }

    @Override
    public NodeInfo describe(String instanceId) {
        return execute(new HttpGet(uri(node(instanceId))), NodeInfo.class);
    }

    @Override
    public int write(String instanceId, byte[] data) {
        HttpPost post = new HttpPost(uri(node(instanceId) + "/write"));
        post.setEntity(new ByteArrayEntity(data, ContentType.APPLICATION_OCTET_STREAM));
        return execute(post, WireMessages.WriteResponse.class).accepted();
    }

    @Override
    public void setCompleted(String instanceId) {
        execute(new HttpPost(uri(node(instanceId) + "/complete")), null);
    }

    @Override
    public void fail(String instanceId, String reason) {
        execute(post(node(instanceId) + "/fail", new WireMessages.FailRequest(reason)), null);
    }

    @Override
    public byte[] readAll(String instanceId) {
        HttpGet get = new HttpGet(uri(node(instanceId) + "/content"));
        try (CloseableHttpResponse response = http.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            byte[] body = response.getEntity() == null ? new byte[0] : EntityUtils.toByteArray(response.getEntity());
            if (status >= 400)
                throw toException(status, new String(body, StandardCharsets.UTF_8));
            return body;
        } catch (IOException e) {
            throw new DeliveryException("Reading " + instanceId + " from manager " + managerId + " failed", e);
        }
    }

    // ── Events & teardown ────────────────────────────────────────

    @Override
    public void deliver(String targetInstanceId, NodeEvent event) {
        execute(post(node(targetInstanceId) + "/events", event), null);
    }

    @Override
    public int shutdownSession(String sessionId) {
        return execute(new HttpDelete(uri(session(sessionId))), WireMessages.ShutdownResponse.class).status();
    }

    @Override
    public void close() throws IOException {
        http.close();
    }

    // ── Transport ────────────────────────────────────────────────

    private <T> T execute(HttpUriRequest request, Class<T> responseType) {
        try (CloseableHttpResponse response = http.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            if (status >= 400)
                throw toException(status, body);
            if (responseType == null)
                return null;
            return mapper.readValue(body, responseType);
        } catch (IOException e) {
            log.debug("{} {} on manager {} failed: {}", request.getMethod(), request.getURI(), managerId,
                    e.getMessage());
            throw new DeliveryException(
                    request.getMethod() + " " + request.getURI().getPath() + " on manager " + managerId + " failed", e);
        }
    }

    /** Rebuilds the server-side exception from an error response. */
    private DataflowException toException(int status, String body) {
        WireMessages.ErrorResponse err;
        try {
            err = mapper.readValue(body, WireMessages.ErrorResponse.class);
        } catch (IOException e) {
            err = new WireMessages.ErrorResponse(null, "HTTP " + status + ": " + body, null, null);
        }
        String message = err.message();
        String type = err.type() == null ? "" : err.type();
        return switch (type) {
            case "UnknownNodeException" -> new UnknownNodeException(message);
            case "NodeFailedException" -> NodeFailedException.remote(err.instanceId(), message);
            case "InvalidStateTransitionException" ->
                InvalidStateTransitionException.remote(err.instanceId(), err.state(), message);
            case "DuplicateConsumerException" -> DuplicateConsumerException.remote(message);
            case "ResourceUnavailableException" -> new ResourceUnavailableException(message);
            case "GraphConstructionException" -> new GraphConstructionException(message);
            default -> switch (status) {
                case 404 -> new UnknownNodeException(message);
                case 503 -> new ResourceUnavailableException(message);
                case 400 -> new GraphConstructionException(message);
                default -> new DataflowException("Manager " + managerId + " failed: " + message);
            };
        };
    }

    private HttpPost post(String path, Object body) {
        HttpPost post = new HttpPost(uri(path));
        try {
            post.setEntity(new StringEntity(mapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize " + body.getClass().getSimpleName(), e);
        }
        return post;
    }

    private URI uri(String path) {
        return baseUri.resolve(path);
    }

    private static String session(String sessionId) {
        return "/api/sessions/" + encode(sessionId);
    }

    private static String node(String instanceId) {
        return "/api/nodes/" + encode(instanceId);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public String toString() {
        return "RemoteNodeManager[" + managerId + " @ " + baseUri + "]";
    }
}
