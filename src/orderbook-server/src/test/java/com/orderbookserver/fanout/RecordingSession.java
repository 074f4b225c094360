package com.orderbookserver.fanout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * In-memory session that records every line offered to it.
 */
public class RecordingSession implements ClientSession {

    private final long id;
    private final List<String> lines = new ArrayList<>();
    private volatile boolean open = true;
    private volatile DeliveryStatus forcedStatus;
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);

    public RecordingSession(long id) {
        this.id = id;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String remoteAddress() {
        return "test/" + id;
    }

    @Override
    public DeliveryStatus offer(String line) {
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                g.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!open) {
            return DeliveryStatus.CLOSED;
        }
        if (forcedStatus != null) {
            return forcedStatus;
        }
        synchronized (lines) {
            lines.add(line);
        }
        return DeliveryStatus.QUEUED;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    public List<String> lines() {
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }

    /**
     * Make every subsequent offer return the given status instead of recording.
     */
    public void failWith(DeliveryStatus status) {
        this.forcedStatus = status;
    }

    /**
     * Block every subsequent offer until the returned latch is released.
     */
    public CountDownLatch hold() {
        CountDownLatch latch = new CountDownLatch(1);
        this.gate = latch;
        return latch;
    }

    public CountDownLatch entered() {
        return entered;
    }
}
