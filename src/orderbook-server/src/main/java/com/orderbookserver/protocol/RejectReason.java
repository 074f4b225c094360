package com.orderbookserver.protocol;

/**
 * Why an inbound line was not turned into an order. Each reason carries the
 * exact text written back to the client.
 */
public enum RejectReason {

    MALFORMED_MESSAGE("Invalid order command."),
    UNSUPPORTED_OPERATION("Operation not supported."),
    UNSUPPORTED_COMMODITY("Commodity not supported."),
    BUSY("Server busy.");

    private final String wireText;

    RejectReason(String wireText) {
        this.wireText = wireText;
    }

    public String wireText() {
        return wireText;
    }
}
