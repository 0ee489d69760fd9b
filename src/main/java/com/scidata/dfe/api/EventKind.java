package com.scidata.dfe.api;

/** Kinds of lifecycle events published on an event channel. */
public enum EventKind {
    COMPLETE,
    ERROR
}
