package com.scidata.dfe.io;

/**
 * Kinds of nodes a pipeline stage or node descriptor can declare.
 */
public enum NodeKind {
    /** Plain data node, written from outside the engine. */
    DATA,
    /** AND-join over child nodes. */
    CONTAINER,
    /** Consumer node running application logic. */
    APP;

    /** Case-insensitive lookup; null means DATA. */
    public static NodeKind fromString(String s) {
        if (s == null)
            return DATA;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node kind: " + s, e);
        }
    }
}
