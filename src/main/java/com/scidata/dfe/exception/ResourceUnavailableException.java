package com.scidata.dfe.exception;

/** A node manager declined a reservation. */
public class ResourceUnavailableException extends DataflowException {

    public ResourceUnavailableException(String message) {
        super(message);
    }

    public ResourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
