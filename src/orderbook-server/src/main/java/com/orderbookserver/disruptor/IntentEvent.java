package com.orderbookserver.disruptor;

import com.orderbookserver.domain.Commodity;
import com.orderbookserver.domain.Side;
import com.orderbookserver.protocol.RejectReason;

/**
 * Pre-allocated mutable event object in the Disruptor ring buffer.
 *
 * A slot carries either a validated intent (side and commodity set) or a
 * rejection to be written back to the client (rejectReason set). Rejections
 * travel through the ring so that every reply to one client leaves in the
 * order its lines arrived.
 */
public class IntentEvent {

    public long clientId;
    public Side side;
    public Commodity commodity;
    public RejectReason rejectReason;

    public boolean isEmpty() {
        return commodity == null && rejectReason == null;
    }

    /**
     * Reset all fields to defaults after the event has been processed.
     */
    public void clear() {
        clientId = 0;
        side = null;
        commodity = null;
        rejectReason = null;
    }
}
