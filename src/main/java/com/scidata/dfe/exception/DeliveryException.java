package com.scidata.dfe.exception;

/** An event or remote call could not be delivered to another manager. */
public class DeliveryException extends DataflowException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
