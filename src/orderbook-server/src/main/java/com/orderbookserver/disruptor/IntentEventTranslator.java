package com.orderbookserver.disruptor;

import com.orderbookserver.domain.Intent;
import com.orderbookserver.protocol.RejectReason;

/**
 * Copies submission data into a claimed ring buffer slot.
 */
public final class IntentEventTranslator {

    private IntentEventTranslator() {
    }

    public static void translate(IntentEvent event, Intent intent) {
        event.clientId = intent.getClientId();
        event.side = intent.getSide();
        event.commodity = intent.getCommodity();
        event.rejectReason = null;
    }

    public static void translateReject(IntentEvent event, long clientId, RejectReason reason) {
        event.clientId = clientId;
        event.side = null;
        event.commodity = null;
        event.rejectReason = reason;
    }
}
