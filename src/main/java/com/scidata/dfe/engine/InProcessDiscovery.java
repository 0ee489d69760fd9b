package com.scidata.dfe.engine;

import com.scidata.dfe.api.ManagerDiscovery;
import com.scidata.dfe.api.NodeManagerService;
import com.scidata.dfe.exception.UnknownNodeException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovery over managers living in the same JVM. Resolving returns the manager
 * itself, so "remote" calls are plain method calls.
 */
public final class InProcessDiscovery implements ManagerDiscovery {
    private final Map<String, NodeManagerService> managers = new ConcurrentHashMap<>();

    /** Registers a manager and points it at this discovery. */
    public InProcessDiscovery register(NodeManager manager) {
        managers.put(manager.managerId(), manager);
        manager.attach(this);
        return this;
    }

    @Override
    public NodeManagerService resolve(String managerId) {
        NodeManagerService m = managers.get(managerId);
        if (m == null)
            throw new UnknownNodeException("Unknown node manager: " + managerId);
        return m;
    }

    @Override
    public Set<String> managerIds() {
        return Collections.unmodifiableSet(managers.keySet());
    }
}
