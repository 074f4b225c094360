package com.orderbookserver.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.protocol.InvalidOrderException;
import com.orderbookserver.protocol.RejectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;

/**
 * Serializes submissions from all network threads onto the single matching
 * thread through a bounded LMAX Disruptor ring.
 *
 * Producers never block: when the ring is full a submission is refused with
 * {@link RejectReason#BUSY} and nothing is recorded.
 */
public class IntentPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IntentPipeline.class);

    private final Disruptor<IntentEvent> disruptor;
    private final RingBuffer<IntentEvent> ringBuffer;

    public IntentPipeline(int ringBufferSize, IntentEventHandler handler) {
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "matching-thread");
            t.setDaemon(true);
            return t;
        };
        this.disruptor = new Disruptor<>(
                new IntentEventFactory(),
                ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        logger.debug("Intent pipeline started. Ring buffer size: {}", ringBufferSize);
    }

    /**
     * Hand a validated intent to the matching thread.
     *
     * @throws InvalidOrderException with {@link RejectReason#BUSY} if the ring is full
     */
    public void submit(Intent intent) throws InvalidOrderException {
        submit(intent, () -> { });
    }

    /**
     * Hand a validated intent to the matching thread, running {@code onAccepted}
     * once a slot is claimed and before the intent is published. Anything
     * {@code onAccepted} does therefore happens before the intent is matched.
     *
     * @throws InvalidOrderException with {@link RejectReason#BUSY} if the ring is full;
     *         {@code onAccepted} is not run in that case
     */
    public void submit(Intent intent, Runnable onAccepted) throws InvalidOrderException {
        long sequence = claim();
        try {
            onAccepted.run();
            IntentEventTranslator.translate(ringBuffer.get(sequence), intent);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Queue a rejection so it is written back in line with the client's
     * other replies.
     *
     * @throws InvalidOrderException with {@link RejectReason#BUSY} if the ring is full
     */
    public void submitReject(long clientId, RejectReason reason) throws InvalidOrderException {
        long sequence = claim();
        try {
            IntentEventTranslator.translateReject(ringBuffer.get(sequence), clientId, reason);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Process everything already published, then stop the matching thread.
     */
    @Override
    public void close() {
        disruptor.shutdown();
        logger.debug("Intent pipeline shut down.");
    }

    private long claim() throws InvalidOrderException {
        try {
            return ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            logger.warn("Ring buffer full. Rejecting submission");
            throw new InvalidOrderException(RejectReason.BUSY);
        }
    }
}
