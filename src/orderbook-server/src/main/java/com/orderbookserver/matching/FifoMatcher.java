package com.orderbookserver.matching;

import com.orderbookserver.domain.Intent;
import com.orderbookserver.domain.MatchResult;
import com.orderbookserver.domain.OrderBook;
import com.orderbookserver.domain.Side;
import com.orderbookserver.domain.Trade;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Unit-quantity, time-priority matching on commodity identity.
 *
 * An incoming intent takes the oldest resting intent on the opposite side.
 * If there is none, it is appended to its own side. There are no prices, so
 * any opposite intent is compatible.
 *
 * Self-trades are allowed: a client may match its own resting intent.
 *
 * Time complexity: O(1) amortized.
 */
public class FifoMatcher implements MatchingAlgorithm {

    private final AtomicLong tradeSequence = new AtomicLong(0);

    @Override
    public MatchResult match(OrderBook book, Intent incoming) {
        Intent resting = book.pollOldest(incoming.getSide().opposite());
        if (resting == null) {
            book.addIntent(incoming);
            return MatchResult.queued();
        }

        Intent buyer = incoming.getSide() == Side.BUY ? incoming : resting;
        Intent seller = incoming.getSide() == Side.BUY ? resting : incoming;
        Trade trade = new Trade(
                generateTradeId(),
                incoming.getCommodity(),
                buyer.getClientId(),
                seller.getClientId());
        return MatchResult.matched(trade);
    }

    private String generateTradeId() {
        return "t-" + String.format("%05d", tradeSequence.incrementAndGet());
    }
}
