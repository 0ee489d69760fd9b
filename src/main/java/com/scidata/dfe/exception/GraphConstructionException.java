package com.scidata.dfe.exception;

/** A pipeline or physical graph is cyclic or otherwise malformed. */
public class GraphConstructionException extends DataflowException {

    public GraphConstructionException(String message) {
        super(message);
    }
}
