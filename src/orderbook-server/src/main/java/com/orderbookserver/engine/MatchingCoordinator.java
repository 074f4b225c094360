package com.orderbookserver.engine;

import com.orderbookserver.domain.Commodity;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.domain.MatchResult;
import com.orderbookserver.domain.OrderBook;
import com.orderbookserver.domain.OrderBookManager;
import com.orderbookserver.domain.Side;
import com.orderbookserver.domain.Trade;
import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.matching.MatchingAlgorithm;
import com.orderbookserver.metrics.MetricsRegistry;
import com.orderbookserver.protocol.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single point of mutation for the order books.
 *
 * In the running server every call arrives on the Disruptor consumer thread,
 * so intents are handled in one total order. The lock keeps the
 * look-then-pop-or-push step atomic for any other caller as well, and lets
 * readers such as the health endpoint take consistent depth snapshots.
 *
 * A matched intent never reaches a queue and the resting intent it matched is
 * removed in the same step, so no intent can match twice and at most one side
 * of a book is non-empty once {@link #handle(Intent)} returns.
 */
public class MatchingCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(MatchingCoordinator.class);

    private final OrderBookManager bookManager;
    private final MatchingAlgorithm matcher;
    private final ExchangeStats stats;
    private final MetricsRegistry metrics;
    private final ReentrantLock lock = new ReentrantLock();

    private long sequence;

    public MatchingCoordinator(OrderBookManager bookManager, MatchingAlgorithm matcher,
                               ExchangeStats stats, MetricsRegistry metrics) {
        this.bookManager = bookManager;
        this.matcher = matcher;
        this.stats = stats;
        this.metrics = metrics;
    }

    /**
     * Match or queue one validated intent.
     *
     * @return the ACK for the submitter, followed by a TRADE broadcast if the
     *         intent matched
     */
    public List<Outcome> handle(Intent intent) {
        long start = System.nanoTime();
        Commodity commodity = intent.getCommodity();

        Intent sequenced;
        MatchResult result;
        lock.lock();
        try {
            OrderBook book = bookManager.getOrCreateBook(commodity);
            sequenced = intent.withSequence(++sequence);
            result = matcher.match(book, sequenced);
            metrics.pendingIntents.labelValues(commodity.symbol(), "buy").set(book.getBidDepth());
            metrics.pendingIntents.labelValues(commodity.symbol(), "sell").set(book.getAskDepth());
        } finally {
            lock.unlock();
        }

        if (intent.getSide() == Side.BUY) {
            stats.buyOrdersReceived.incrementAndGet();
        } else {
            stats.sellOrdersReceived.incrementAndGet();
        }
        metrics.ordersReceivedTotal.labelValues(intent.getSide().label()).inc();

        List<Outcome> outcomes = new ArrayList<>(2);
        outcomes.add(Outcome.ack(intent.getClientId(), commodity));

        if (result.isMatched()) {
            Trade trade = result.getTrade();
            logger.info("trade {}", commodity);
            logger.debug("Trade {}: seq {} buyer {} seller {}", trade.tradeId(),
                    sequenced.getSequence(), trade.buyerClientId(), trade.sellerClientId());
            stats.tradesExecuted.incrementAndGet();
            metrics.tradesTotal.labelValues(commodity.symbol()).inc();
            outcomes.add(Outcome.trade(commodity));
        }

        metrics.handleDuration.observe((System.nanoTime() - start) / 1_000_000_000.0);
        return outcomes;
    }

    /**
     * Resting intents on one side of a commodity's book, oldest first.
     */
    public List<Intent> pendingIntents(Commodity commodity, Side side) {
        lock.lock();
        try {
            OrderBook book = bookManager.getBook(commodity);
            return book == null ? List.of() : book.snapshot(side);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Depth of every commodity's book, in registry order. Commodities that
     * never saw an intent report zero on both sides.
     */
    public List<BookDepth> depthSnapshot() {
        List<BookDepth> depths = new ArrayList<>(Commodity.values().length);
        lock.lock();
        try {
            for (Commodity commodity : Commodity.values()) {
                OrderBook book = bookManager.getBook(commodity);
                if (book == null) {
                    depths.add(new BookDepth(commodity, 0, 0));
                } else {
                    depths.add(new BookDepth(commodity, book.getBidDepth(), book.getAskDepth()));
                }
            }
        } finally {
            lock.unlock();
        }
        return depths;
    }
}
