package com.scidata.dfe.exception;

/** A consumer was registered twice on the same producer. */
public class DuplicateConsumerException extends DataflowException {

    public DuplicateConsumerException(String producerId, String consumerId) {
        super("Consumer " + consumerId + " is already registered on " + producerId);
    }

    private DuplicateConsumerException(String message) {
        super(message);
    }

    /** Rebuilds an error reported by a remote manager, keeping its message. */
    public static DuplicateConsumerException remote(String message) {
        return new DuplicateConsumerException(message);
    }
}
