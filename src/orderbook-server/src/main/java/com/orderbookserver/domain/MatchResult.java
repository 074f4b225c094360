package com.orderbookserver.domain;

/**
 * Outcome of submitting one intent to an order book: either it matched a
 * resting intent and produced a trade, or it was queued.
 */
public final class MatchResult {

    private static final MatchResult QUEUED = new MatchResult(null);

    private final Trade trade;

    private MatchResult(Trade trade) {
        this.trade = trade;
    }

    public static MatchResult matched(Trade trade) {
        if (trade == null) {
            throw new IllegalArgumentException("Matched result requires a trade");
        }
        return new MatchResult(trade);
    }

    public static MatchResult queued() {
        return QUEUED;
    }

    public boolean isMatched() {
        return trade != null;
    }

    /**
     * @return the trade, or null if the intent was queued
     */
    public Trade getTrade() {
        return trade;
    }
}
