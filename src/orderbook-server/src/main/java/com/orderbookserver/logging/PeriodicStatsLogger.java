package com.orderbookserver.logging;

import com.orderbookserver.engine.BookDepth;
import com.orderbookserver.engine.MatchingCoordinator;
import com.orderbookserver.fanout.NotificationFanout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate exchange statistics every N seconds on a separate daemon
 * thread. Never touches the order books except through the coordinator's
 * snapshot.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final ExchangeStats stats;
    private final MatchingCoordinator coordinator;
    private final NotificationFanout fanout;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastBuyOrders;
    private long lastSellOrders;
    private long lastTrades;
    private long lastRejected;
    private long lastDropped;

    public PeriodicStatsLogger(ExchangeStats stats, MatchingCoordinator coordinator,
                               NotificationFanout fanout, int intervalSeconds) {
        this.stats = stats;
        this.coordinator = coordinator;
        this.fanout = fanout;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (intervalSeconds <= 0) {
            logger.info("Periodic stats logger disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.debug("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        long totalBuy = stats.buyOrdersReceived.get();
        long totalSell = stats.sellOrdersReceived.get();
        long totalOrders = totalBuy + totalSell;

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("totalBuyOrders", totalBuy),
                keyValue("totalSellOrders", totalSell),
                keyValue("totalOrders", totalOrders),
                keyValue("totalTrades", stats.tradesExecuted.get()),
                keyValue("totalRejected", stats.ordersRejected.get()),
                keyValue("totalDropped", stats.notificationsDropped.get()));
    }

    void logSummary() {
        try {
            long currentBuy = stats.buyOrdersReceived.get();
            long currentSell = stats.sellOrdersReceived.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentRejected = stats.ordersRejected.get();
            long currentDropped = stats.notificationsDropped.get();

            long deltaBuy = currentBuy - lastBuyOrders;
            long deltaSell = currentSell - lastSellOrders;
            long deltaTrades = currentTrades - lastTrades;
            long deltaRejected = currentRejected - lastRejected;
            long deltaDropped = currentDropped - lastDropped;

            lastBuyOrders = currentBuy;
            lastSellOrders = currentSell;
            lastTrades = currentTrades;
            lastRejected = currentRejected;
            lastDropped = currentDropped;

            int pendingBuys = 0;
            int pendingSells = 0;
            for (BookDepth depth : coordinator.depthSnapshot()) {
                pendingBuys += depth.pendingBuys();
                pendingSells += depth.pendingSells();
            }

            logger.debug("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("buyOrders", deltaBuy),
                    keyValue("sellOrders", deltaSell),
                    keyValue("trades", deltaTrades),
                    keyValue("rejected", deltaRejected),
                    keyValue("dropped", deltaDropped),
                    keyValue("sessions", fanout.getSessionCount()),
                    keyValue("pendingBuys", pendingBuys),
                    keyValue("pendingSells", pendingSells));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}
