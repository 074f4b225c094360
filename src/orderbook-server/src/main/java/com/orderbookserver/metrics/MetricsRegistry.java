package com.orderbookserver.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the orderbook server, defined in one place.
 */
public class MetricsRegistry {

    public final Histogram handleDuration;
    // name: ob_handle_duration_seconds

    public final Counter ordersReceivedTotal;
    // name: ob_orders_received_total

    public final Counter ordersRejectedTotal;
    // name: ob_orders_rejected_total

    public final Counter tradesTotal;
    // name: ob_trades_total

    public final Counter notificationsDroppedTotal;
    // name: ob_notifications_dropped_total

    public final Gauge sessionsConnected;
    // name: ob_sessions_connected

    public final Gauge pendingIntents;
    // name: ob_pending_intents

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    /**
     * Metrics registered in the JVM-wide default registry, together with the
     * JVM metrics (GC, memory, threads).
     */
    public MetricsRegistry() {
        this(PrometheusRegistry.defaultRegistry);
        JvmMetrics.builder().register(registry);
    }

    public MetricsRegistry(PrometheusRegistry registry) {
        this.registry = registry;

        // Time spent inside the matching critical section per intent
        handleDuration = Histogram.builder()
                .name("ob_handle_duration_seconds")
                .help("Time spent matching one intent")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01)
                .register(registry);

        ordersReceivedTotal = Counter.builder()
                .name("ob_orders_received_total")
                .help("Total valid orders received")
                .labelNames("side")
                .register(registry);

        ordersRejectedTotal = Counter.builder()
                .name("ob_orders_rejected_total")
                .help("Total inbound lines rejected")
                .labelNames("reason")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("ob_trades_total")
                .help("Total trades executed")
                .labelNames("commodity")
                .register(registry);

        notificationsDroppedTotal = Counter.builder()
                .name("ob_notifications_dropped_total")
                .help("Outbound lines not delivered to a session")
                .labelNames("reason")
                .register(registry);

        sessionsConnected = Gauge.builder()
                .name("ob_sessions_connected")
                .help("Currently registered client sessions")
                .register(registry);

        pendingIntents = Gauge.builder()
                .name("ob_pending_intents")
                .help("Resting intents waiting for a counterparty")
                .labelNames("commodity", "side")
                .register(registry);
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
