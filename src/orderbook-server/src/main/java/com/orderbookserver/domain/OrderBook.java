package com.orderbookserver.domain;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Pending intents for a single commodity.
 *
 * Bids and asks are FIFO queues: the head is the oldest resting intent and
 * is always the next one to match. Not thread-safe; owned by the matching
 * thread.
 */
public class OrderBook {

    private final Commodity commodity;
    private final ArrayDeque<Intent> bids;
    private final ArrayDeque<Intent> asks;

    public OrderBook(Commodity commodity) {
        this.commodity = commodity;
        this.bids = new ArrayDeque<>();
        this.asks = new ArrayDeque<>();
    }

    /**
     * Append an intent to the back of its own side.
     */
    public void addIntent(Intent intent) {
        if (intent.getCommodity() != commodity) {
            throw new IllegalArgumentException(
                    "Intent for " + intent.getCommodity() + " added to book " + commodity);
        }
        queueFor(intent.getSide()).addLast(intent);
    }

    /**
     * Remove and return the oldest resting intent on the given side, or null.
     */
    public Intent pollOldest(Side side) {
        return queueFor(side).pollFirst();
    }

    public Intent peekOldest(Side side) {
        return queueFor(side).peekFirst();
    }

    public int getBidDepth() {
        return bids.size();
    }

    public int getAskDepth() {
        return asks.size();
    }

    /**
     * Copy of the resting intents on one side, oldest first.
     */
    public List<Intent> snapshot(Side side) {
        return List.copyOf(queueFor(side));
    }

    public Commodity getCommodity() {
        return commodity;
    }

    private ArrayDeque<Intent> queueFor(Side side) {
        return side == Side.BUY ? bids : asks;
    }
}
