package com.scidata.dfe.api;

import java.util.Set;

/**
 * Resolves node manager identifiers to callable services.
 *
 * Every remote reference in the engine goes through an explicit resolve call;
 * there is no implicit naming state.
 */
public interface ManagerDiscovery {

    /**
     * @param managerId Identifier of the manager.
     * @return A service for the manager: the manager itself when in-process, a
     *         client stub otherwise.
     * @throws com.scidata.dfe.exception.UnknownNodeException if the manager is
     *                                                         not known.
     */
    NodeManagerService resolve(String managerId);

    Set<String> managerIds();
}
