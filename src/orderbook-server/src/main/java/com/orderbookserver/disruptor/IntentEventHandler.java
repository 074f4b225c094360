package com.orderbookserver.disruptor;

import com.lmax.disruptor.EventHandler;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.engine.MatchingCoordinator;
import com.orderbookserver.fanout.NotificationFanout;
import com.orderbookserver.protocol.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The single-threaded event processor.
 *
 * Runs on the one thread managed by the Disruptor's BatchEventProcessor, so
 * every intent is matched and its notifications are queued before the next
 * intent is looked at. The ACK goes to the submitter before the TRADE is
 * broadcast, and all sessions see trades in the order they were produced.
 *
 * Processing pipeline per event:
 * 1. Rejections: write the error line to the submitter, done
 * 2. Match the intent through the coordinator
 * 3. Send the ACK directly to the submitting session
 * 4. Broadcast the TRADE (if any) to every registered session
 */
public class IntentEventHandler implements EventHandler<IntentEvent> {

    private static final Logger logger = LoggerFactory.getLogger(IntentEventHandler.class);

    private final MatchingCoordinator coordinator;
    private final NotificationFanout fanout;

    public IntentEventHandler(MatchingCoordinator coordinator, NotificationFanout fanout) {
        this.coordinator = coordinator;
        this.fanout = fanout;
    }

    @Override
    public void onEvent(IntentEvent event, long sequence, boolean endOfBatch) {
        if (event.isEmpty()) {
            return;
        }

        try {
            if (event.rejectReason != null) {
                fanout.sendDirect(event.clientId, event.rejectReason.wireText());
                return;
            }

            Intent intent = new Intent(event.clientId, event.side, event.commodity);
            List<Outcome> outcomes = coordinator.handle(intent);
            for (Outcome outcome : outcomes) {
                if (outcome.isBroadcast()) {
                    fanout.broadcast(outcome.toLine());
                } else {
                    fanout.sendDirect(outcome.getClientId(), outcome.toLine());
                }
            }
        } catch (Exception e) {
            logger.error("Error processing event sequence {}: {}", sequence, e.getMessage(), e);
        } finally {
            event.clear();
        }
    }
}
