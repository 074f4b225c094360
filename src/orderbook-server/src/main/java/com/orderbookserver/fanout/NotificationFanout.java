package com.orderbookserver.fanout;

import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers outbound lines to registered client sessions.
 *
 * Delivery is best-effort and never blocks: a closed session is silently
 * deregistered, a session whose outbound buffer is full loses that line,
 * and a session whose write fails is closed and deregistered. None of these
 * affect delivery to the other sessions.
 *
 * Registration is independent of the matching thread, so sessions can come
 * and go while broadcasts are in flight.
 */
public class NotificationFanout {

    private static final Logger logger = LoggerFactory.getLogger(NotificationFanout.class);

    private final ConcurrentHashMap<Long, ClientSession> sessions;
    private final ExchangeStats stats;
    private final MetricsRegistry metrics;

    public NotificationFanout(ExchangeStats stats, MetricsRegistry metrics) {
        this.sessions = new ConcurrentHashMap<>();
        this.stats = stats;
        this.metrics = metrics;
    }

    /**
     * Add a session to the fan-out. Closing the returned registration removes
     * it again; closing more than once is harmless.
     */
    public Registration register(ClientSession session) {
        ClientSession previous = sessions.putIfAbsent(session.id(), session);
        if (previous != null) {
            throw new IllegalStateException("Session " + session.id() + " is already registered");
        }
        updateSessionGauge();
        return new Registration(session);
    }

    /**
     * Deliver a line to every registered session.
     *
     * @return number of sessions the line was queued for
     */
    public int broadcast(String line) {
        int delivered = 0;
        for (ClientSession session : sessions.values()) {
            if (deliver(session, line)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Deliver a line to one session only.
     *
     * @return true if the line was queued
     */
    public boolean sendDirect(long sessionId, String line) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) {
            logger.debug("Session {} is gone, dropping {}", sessionId, line);
            recordDrop(DeliveryStatus.CLOSED);
            return false;
        }
        return deliver(session, line);
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private boolean deliver(ClientSession session, String line) {
        DeliveryStatus status;
        try {
            status = session.offer(line);
        } catch (RuntimeException e) {
            logger.warn("Write to session {} failed: {}", session.id(), e.getMessage());
            status = DeliveryStatus.FAILED;
        }

        switch (status) {
            case QUEUED:
                return true;
            case OVERFLOW:
                logger.warn("Outbound buffer full for session {} ({}), dropped {}",
                        session.id(), session.remoteAddress(), line);
                break;
            case CLOSED:
                deregister(session);
                break;
            case FAILED:
                deregister(session);
                session.close();
                break;
            default:
                break;
        }
        recordDrop(status);
        return false;
    }

    private void deregister(ClientSession session) {
        if (sessions.remove(session.id(), session)) {
            updateSessionGauge();
        }
    }

    private void recordDrop(DeliveryStatus status) {
        stats.notificationsDropped.incrementAndGet();
        metrics.notificationsDroppedTotal.labelValues(status.name().toLowerCase()).inc();
    }

    private void updateSessionGauge() {
        metrics.sessionsConnected.set(sessions.size());
    }

    /**
     * Handle returned by {@link #register(ClientSession)}.
     */
    public final class Registration implements AutoCloseable {

        private final ClientSession session;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Registration(ClientSession session) {
            this.session = session;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                deregister(session);
            }
        }
    }
}
