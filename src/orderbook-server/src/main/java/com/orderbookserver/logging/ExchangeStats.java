package com.orderbookserver.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the matching thread, the network threads
 * (writers) and the periodic stats logger thread (reader).
 */
public class ExchangeStats {

    public final AtomicLong buyOrdersReceived = new AtomicLong();
    public final AtomicLong sellOrdersReceived = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong ordersRejected = new AtomicLong();
    public final AtomicLong notificationsDropped = new AtomicLong();
}
