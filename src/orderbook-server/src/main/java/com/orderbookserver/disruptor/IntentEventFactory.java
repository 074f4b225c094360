package com.orderbookserver.disruptor;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating IntentEvent instances in the ring buffer.
 */
public class IntentEventFactory implements EventFactory<IntentEvent> {

    @Override
    public IntentEvent newInstance() {
        return new IntentEvent();
    }
}
