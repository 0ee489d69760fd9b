package com.scidata.dfe.exception;

/**
 * Root of all engine errors. Unchecked: state-machine violations are programming
 * or orchestration errors the caller handles at the boundary, not per call.
 */
public class DataflowException extends RuntimeException {

    public DataflowException(String message) {
        super(message);
    }

    public DataflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
