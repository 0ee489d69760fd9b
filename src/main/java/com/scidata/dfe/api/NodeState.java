package com.scidata.dfe.api;

/**
 * Lifecycle states of a {@link DataNode}.
 *
 * Transitions:
 * INITIALIZED -> WRITING -> COMPLETE | ERROR
 * INITIALIZED -> COMPLETE (zero-byte nodes, joins)
 * any non-EXPIRED state -> EXPIRED (session teardown)
 *
 * COMPLETE and ERROR are terminal for data purposes; a terminal node only ever
 * moves on to EXPIRED when its session is torn down.
 */
public enum NodeState {
    INITIALIZED,
    WRITING,
    COMPLETE,
    ERROR,
    EXPIRED;

    /** True once the node can no longer accept writes or change outcome. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == EXPIRED;
    }

    /** True while the node may still receive data. */
    public boolean acceptsWrites() {
        return this == INITIALIZED || this == WRITING;
    }
}
