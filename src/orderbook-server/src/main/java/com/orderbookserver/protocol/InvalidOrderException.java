package com.orderbookserver.protocol;

/**
 * Thrown when an inbound line cannot be accepted. Rejection never changes
 * order book state.
 */
public class InvalidOrderException extends Exception {

    private final RejectReason reason;

    public InvalidOrderException(RejectReason reason) {
        super(reason.wireText());
        this.reason = reason;
    }

    public RejectReason getReason() {
        return reason;
    }
}
