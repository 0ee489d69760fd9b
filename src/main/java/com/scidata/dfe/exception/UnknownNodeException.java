package com.scidata.dfe.exception;

/** Lookup of a node (or manager) that does not exist or was torn down. */
public class UnknownNodeException extends DataflowException {

    public UnknownNodeException(String message) {
        super(message);
    }
}
