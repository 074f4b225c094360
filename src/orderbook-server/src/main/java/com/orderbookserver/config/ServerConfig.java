package com.orderbookserver.config;

import java.util.Map;

/**
 * Configuration parsed from environment variables.
 */
public class ServerConfig {

    public static final String DEFAULT_LISTEN_HOST = "127.0.0.1";
    public static final int DEFAULT_LISTEN_PORT = 8888;
    public static final int DEFAULT_HTTP_PORT = 8081;
    public static final int DEFAULT_METRICS_PORT = 9091;
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    public static final int DEFAULT_OUTBOUND_HIGH_WATER_MARK = 64 * 1024;
    public static final int DEFAULT_STATS_INTERVAL_SECONDS = 10;

    private final String listenHost;
    private final int listenPort;
    private final int httpPort;
    private final int metricsPort;
    private final int ringBufferSize;
    private final int outboundHighWaterMark;
    private final int statsIntervalSeconds;

    public ServerConfig(String listenHost, int listenPort, int httpPort, int metricsPort,
                        int ringBufferSize, int outboundHighWaterMark, int statsIntervalSeconds) {
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException(
                    "Ring buffer size must be a positive power of two: " + ringBufferSize);
        }
        if (outboundHighWaterMark <= 0) {
            throw new IllegalArgumentException(
                    "Outbound high water mark must be positive: " + outboundHighWaterMark);
        }
        this.listenHost = listenHost;
        this.listenPort = listenPort;
        this.httpPort = httpPort;
        this.metricsPort = metricsPort;
        this.ringBufferSize = ringBufferSize;
        this.outboundHighWaterMark = outboundHighWaterMark;
        this.statsIntervalSeconds = statsIntervalSeconds;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static ServerConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static ServerConfig fromMap(Map<String, String> env) {
        String listenHost = get(env, "LISTEN_HOST", DEFAULT_LISTEN_HOST);
        int listenPort = getInt(env, "LISTEN_PORT", DEFAULT_LISTEN_PORT);
        int httpPort = getInt(env, "HTTP_PORT", DEFAULT_HTTP_PORT);
        int metricsPort = getInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT);
        int ringBufferSize = getInt(env, "RING_BUFFER_SIZE", DEFAULT_RING_BUFFER_SIZE);
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            ringBufferSize = DEFAULT_RING_BUFFER_SIZE;
        }
        int highWaterMark = getInt(env, "OUTBOUND_HIGH_WATER_MARK_BYTES",
                DEFAULT_OUTBOUND_HIGH_WATER_MARK);
        if (highWaterMark <= 0) {
            highWaterMark = DEFAULT_OUTBOUND_HIGH_WATER_MARK;
        }
        int statsInterval = getInt(env, "STATS_INTERVAL_SECONDS", DEFAULT_STATS_INTERVAL_SECONDS);

        return new ServerConfig(listenHost, listenPort, httpPort, metricsPort,
                ringBufferSize, highWaterMark, statsInterval);
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getListenHost() {
        return listenHost;
    }

    public int getListenPort() {
        return listenPort;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public int getOutboundHighWaterMark() {
        return outboundHighWaterMark;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "listenHost='" + listenHost + '\'' +
                ", listenPort=" + listenPort +
                ", httpPort=" + httpPort +
                ", metricsPort=" + metricsPort +
                ", ringBufferSize=" + ringBufferSize +
                ", outboundHighWaterMark=" + outboundHighWaterMark +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                '}';
    }
}
