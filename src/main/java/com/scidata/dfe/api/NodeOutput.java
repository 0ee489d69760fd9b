package com.scidata.dfe.api;

import java.nio.charset.StandardCharsets;

/**
 * Write side of a consumer node, as seen by its application logic.
 */
public interface NodeOutput {

    String instanceId();

    int write(byte[] data);

    default int write(String text) {
        return write(text.getBytes(StandardCharsets.UTF_8));
    }
}
