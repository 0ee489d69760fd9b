package com.scidata.dfe.engine;

import com.scidata.dfe.api.ChecksumFactory;
import com.scidata.dfe.api.DataStorage;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.fn.AppRegistry;
import com.scidata.dfe.io.EngineConfig;
import com.scidata.dfe.io.NodeDescriptor;
import com.scidata.dfe.node.AbstractDataNode;
import com.scidata.dfe.node.ConsumerNode;
import com.scidata.dfe.node.ContainerNode;
import com.scidata.dfe.node.DataObjectNode;
import com.scidata.dfe.storage.Checksums;
import com.scidata.dfe.storage.FileStorage;
import com.scidata.dfe.storage.InMemoryStorage;
import com.scidata.dfe.wiring.EventChannel;

import java.nio.file.Path;
import java.util.Map;

/**
 * Turns {@link NodeDescriptor}s into live nodes bound to a session's channel.
 */
public final class NodeFactory {
    private final AppRegistry apps;
    private final Path storageDirectory;
    private final ChecksumFactory checksums;

    public NodeFactory(AppRegistry apps, EngineConfig config) {
        this.apps = apps;
        this.storageDirectory = Path.of(config.getStorageDirectory());
        this.checksums = Checksums.byName(config.getChecksum());
    }

    /**
     * Checks a descriptor without creating anything, so a manager can decline a
     * reservation it could never commit.
     *
     * @throws GraphConstructionException if the descriptor is unusable.
     */
    public void validate(NodeDescriptor d) {
        if (d.getObjectId() == null)
            throw new GraphConstructionException("Node " + d.getInstanceId() + " has no object id");
        switch (d.getKind()) {
            case APP -> {
                if (!apps.contains(d.getApp()))
                    throw new GraphConstructionException("Unknown application '" + d.getApp() + "' for node "
                            + d.getInstanceId());
            }
            case DATA, CONTAINER -> {
            }
        }
        String storage = d.getStorage();
        if (storage != null && !NodeDescriptor.STORAGE_MEMORY.equals(storage)
                && !NodeDescriptor.STORAGE_FILE.equals(storage))
            throw new GraphConstructionException("Unknown storage '" + storage + "' for node " + d.getInstanceId());
    }

    public AbstractDataNode create(NodeDescriptor d, EventChannel channel) {
        validate(d);
        return switch (d.getKind()) {
            case DATA -> new DataObjectNode(d.getObjectId(), d.getInstanceId(), channel, storageFor(d), checksums,
                    d.getExpectedSize());
            case CONTAINER -> new ContainerNode(d.getObjectId(), d.getInstanceId(), channel);
            case APP -> {
                Map<String, Object> props = d.getProperties() != null ? d.getProperties() : Map.of();
                yield new ConsumerNode(d.getObjectId(), d.getInstanceId(), channel, storageFor(d), checksums,
                        d.getApp(), apps.create(d.getApp(), props));
            }
        };
    }

    private DataStorage storageFor(NodeDescriptor d) {
        if (NodeDescriptor.STORAGE_FILE.equals(d.getStorage()))
            return new FileStorage(storageDirectory.resolve(d.getInstanceId().split(":", 2)[0]), d.getInstanceId());
        return new InMemoryStorage();
    }
}
