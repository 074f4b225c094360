package com.orderbookserver;

import com.orderbookserver.config.ServerConfig;
import com.orderbookserver.disruptor.IntentEventHandler;
import com.orderbookserver.disruptor.IntentPipeline;
import com.orderbookserver.domain.OrderBookManager;
import com.orderbookserver.engine.MatchingCoordinator;
import com.orderbookserver.fanout.NotificationFanout;
import com.orderbookserver.http.HealthHttpHandler;
import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.logging.PeriodicStatsLogger;
import com.orderbookserver.matching.FifoMatcher;
import com.orderbookserver.metrics.MetricsRegistry;
import com.orderbookserver.server.ExchangeServer;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point for the orderbook server.
 *
 * Startup sequence:
 * 1. Parse ServerConfig from environment variables
 * 2. Initialize MetricsRegistry + Prometheus HTTP server
 * 3. Initialize OrderBookManager, FifoMatcher and MatchingCoordinator
 * 4. Initialize NotificationFanout
 * 5. Start the IntentPipeline (Disruptor) with IntentEventHandler
 * 6. Start the periodic stats logger
 * 7. Start the health HttpServer
 * 8. Start the TCP ExchangeServer
 * 9. Register JVM shutdown hook and wait
 */
public class OrderbookServerApp {

    private static final Logger logger = LoggerFactory.getLogger(OrderbookServerApp.class);

    public static void main(String[] args) throws InterruptedException {
        logger.debug("Starting orderbook server...");

        // 1. Parse configuration from environment variables
        ServerConfig config = ServerConfig.fromEnv();
        logger.debug("Configuration: {}", config);

        // 2. Metrics
        MetricsRegistry metrics = new MetricsRegistry();
        if (config.getMetricsPort() > 0) {
            try {
                metrics.startHttpServer(config.getMetricsPort());
                logger.debug("Prometheus metrics HTTP server started on port {}",
                        config.getMetricsPort());
            } catch (IOException e) {
                logger.warn("Failed to start Prometheus HTTP server on port {}: {}. Continuing without it.",
                        config.getMetricsPort(), e.getMessage());
            }
        }

        // 3. Matching core
        ExchangeStats stats = new ExchangeStats();
        MatchingCoordinator coordinator = new MatchingCoordinator(
                new OrderBookManager(), new FifoMatcher(), stats, metrics);

        // 4. Fan-out
        NotificationFanout fanout = new NotificationFanout(stats, metrics);

        // 5. Disruptor
        IntentPipeline pipeline = new IntentPipeline(config.getRingBufferSize(),
                new IntentEventHandler(coordinator, fanout));

        // 6. Periodic stats
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                stats, coordinator, fanout, config.getStatsIntervalSeconds());
        statsLogger.start();

        // 7. Health endpoint
        HttpServer httpServer = null;
        ExecutorService httpExecutor = null;
        if (config.getHttpPort() > 0) {
            try {
                httpServer = HttpServer.create(new InetSocketAddress(config.getHttpPort()), 0);
                httpServer.createContext("/health", new HealthHttpHandler(coordinator, fanout));
                httpExecutor = Executors.newSingleThreadExecutor();
                httpServer.setExecutor(httpExecutor);
                httpServer.start();
                logger.debug("Health endpoint started on port {}", config.getHttpPort());
            } catch (IOException e) {
                logger.warn("Failed to start health endpoint on port {}: {}. Continuing without it.",
                        config.getHttpPort(), e.getMessage());
                httpServer = null;
            }
        }

        // 8. TCP server
        ExchangeServer server = new ExchangeServer(config, pipeline, fanout, stats, metrics);
        server.start();

        // 9. Shutdown hook
        final HttpServer httpServerRef = httpServer;
        final ExecutorService httpExecutorRef = httpExecutor;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.debug("Shutting down orderbook server...");
            server.close();
            if (httpServerRef != null) {
                httpServerRef.stop(0);
                httpExecutorRef.shutdownNow();
            }
            try {
                pipeline.close();
            } catch (Exception e) {
                logger.warn("Error shutting down intent pipeline: {}", e.getMessage());
            }

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.debug("Orderbook server shut down complete.");
        }, "shutdown-hook"));

        server.awaitTermination();
    }
}
