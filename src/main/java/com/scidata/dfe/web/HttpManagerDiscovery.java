package com.scidata.dfe.web;

import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeManagerService;
import com.scidata.dfe.exception.UnknownNodeException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovery of managers reachable over HTTP. Maps manager ids to server
 * addresses and hands out one cached {@link RemoteNodeManager} per manager.
 */
public final class HttpManagerDiscovery implements ManagerDiscovery, Closeable {
    private static final Logger log = LogManager.getLogger(HttpManagerDiscovery.class);

    private final Map<String, URI> addresses = new ConcurrentHashMap<>();
    private final Map<String, RemoteNodeManager> stubs = new ConcurrentHashMap<>();
    private final int timeoutMillis;

    public HttpManagerDiscovery(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public HttpManagerDiscovery register(String managerId, URI address) {
        addresses.put(managerId, address);
        RemoteNodeManager stale = stubs.remove(managerId);
        if (stale != null)
            closeQuietly(stale);
        return this;
    }

    public URI address(String managerId) {
        return addresses.get(managerId);
    }

    @Override
    public NodeManagerService resolve(String managerId) {
        return stub(managerId);
    }

    /** Typed variant of {@link #resolve}. */
    public RemoteNodeManager stub(String managerId) {
        URI address = addresses.get(managerId);
        if (address == null)
            throw new UnknownNodeException("Unknown node manager: " + managerId);
        return stubs.computeIfAbsent(managerId, id -> {
            RemoteNodeManager stub = new RemoteNodeManager(id, address, timeoutMillis);
            stub.attach(this);
            return stub;
        });
    }

    @Override
    public Set<String> managerIds() {
        return Collections.unmodifiableSet(addresses.keySet());
    }

    @Override
    public void close() {
        stubs.values().forEach(HttpManagerDiscovery::closeQuietly);
        stubs.clear();
    }

    private static void closeQuietly(RemoteNodeManager stub) {
        try {
            stub.close();
        } catch (IOException e) {
            log.warn("Closing client for {} failed: {}", stub.managerId(), e.getMessage());
        }
    }
}
