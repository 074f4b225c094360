package com.orderbookserver.domain;

import com.orderbookserver.protocol.InvalidOrderException;
import com.orderbookserver.protocol.RejectReason;

public enum Side {

    BUY("BUY", "buy"),
    SELL("SELL", "sell");

    private final String wireText;
    private final String label;

    Side(String wireText, String label) {
        this.wireText = wireText;
        this.label = label;
    }

    public static Side fromWire(String text) throws InvalidOrderException {
        if (BUY.wireText.equals(text)) {
            return BUY;
        }
        if (SELL.wireText.equals(text)) {
            return SELL;
        }
        throw new InvalidOrderException(RejectReason.UNSUPPORTED_OPERATION);
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Lower-case name used in log lines, e.g. "new buy order".
     */
    public String label() {
        return label;
    }
}
