package com.orderbookserver.fanout;

/**
 * One live client connection as seen by the notification fan-out.
 *
 * Implementations must not block in {@link #offer(String)}.
 */
public interface ClientSession {

    long id();

    String remoteAddress();

    /**
     * Queue a single protocol line (without terminator) for delivery.
     */
    DeliveryStatus offer(String line);

    boolean isOpen();

    void close();
}
