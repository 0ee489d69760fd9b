package com.scidata.dfe.node;

import com.scidata.dfe.api.ChecksumFactory;
import com.scidata.dfe.api.DataStorage;
import com.scidata.dfe.storage.Checksums;
import com.scidata.dfe.storage.FileStorage;
import com.scidata.dfe.storage.InMemoryStorage;
import com.scidata.dfe.wiring.EventChannel;

import java.nio.file.Path;

/**
 * A plain data node: bytes in, bytes out, no behaviour of its own.
 */
public final class DataObjectNode extends AbstractDataNode {

    public DataObjectNode(String objectId, String instanceId, EventChannel channel, DataStorage storage,
            ChecksumFactory checksums, long expectedSize) {
        super(objectId, instanceId, channel, storage, checksums, expectedSize);
    }

    /** In-memory node that completes only on request. */
    public static DataObjectNode inMemory(String objectId, String instanceId, EventChannel channel) {
        return inMemory(objectId, instanceId, channel, -1);
    }

    public static DataObjectNode inMemory(String objectId, String instanceId, EventChannel channel,
            long expectedSize) {
        return new DataObjectNode(objectId, instanceId, channel, new InMemoryStorage(), Checksums.CRC_32,
                expectedSize);
    }

    public static DataObjectNode file(String objectId, String instanceId, EventChannel channel, Path directory,
            long expectedSize) {
        return new DataObjectNode(objectId, instanceId, channel, new FileStorage(directory, instanceId),
                Checksums.CRC_32, expectedSize);
    }

    @Override
    public String kind() {
        return "data";
    }

    @Override
    public boolean isContainer() {
        return false;
    }
}
