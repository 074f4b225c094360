package com.orderbookserver.domain;

import com.orderbookserver.protocol.InvalidOrderException;
import com.orderbookserver.protocol.RejectReason;

/**
 * The closed set of tradable symbols. Symbols are matched exactly and are
 * case-sensitive.
 */
public enum Commodity {

    APPLE("APPLE"),
    PEAR("PEAR"),
    TOMATO("TOMATO"),
    POTATO("POTATO"),
    ONION("ONION");

    private final String symbol;

    Commodity(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolve a wire symbol to its commodity.
     *
     * @throws InvalidOrderException with {@link RejectReason#UNSUPPORTED_COMMODITY}
     *         if the symbol is not one of the registered commodities
     */
    public static Commodity fromSymbol(String symbol) throws InvalidOrderException {
        for (Commodity commodity : values()) {
            if (commodity.symbol.equals(symbol)) {
                return commodity;
            }
        }
        throw new InvalidOrderException(RejectReason.UNSUPPORTED_COMMODITY);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
