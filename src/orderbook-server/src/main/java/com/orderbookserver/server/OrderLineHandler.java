package com.orderbookserver.server;

import com.orderbookserver.disruptor.IntentPipeline;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.fanout.NotificationFanout;
import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.metrics.MetricsRegistry;
import com.orderbookserver.protocol.IntentParser;
import com.orderbookserver.protocol.InvalidOrderException;
import com.orderbookserver.protocol.RejectReason;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one client connection.
 *
 * Parses each inbound line into an intent and hands it to the matching
 * pipeline. Replies (ACK or error text) and trade broadcasts are written by
 * the matching thread through the session registered here.
 */
public class OrderLineHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(OrderLineHandler.class);

    private final long sessionId;
    private final IntentPipeline pipeline;
    private final NotificationFanout fanout;
    private final ExchangeStats stats;
    private final MetricsRegistry metrics;

    private ChannelClientSession session;
    private NotificationFanout.Registration registration;
    private String peer;

    public OrderLineHandler(long sessionId, IntentPipeline pipeline, NotificationFanout fanout,
                            ExchangeStats stats, MetricsRegistry metrics) {
        this.sessionId = sessionId;
        this.pipeline = pipeline;
        this.fanout = fanout;
        this.stats = stats;
        this.metrics = metrics;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        peer = ChannelClientSession.describePeer(ctx.channel().remoteAddress());
        session = new ChannelClientSession(sessionId, ctx.channel());
        registration = fanout.register(session);
        logger.info("connected {}", peer);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (registration != null) {
            registration.close();
        }
        logger.info("disconnected {}", peer);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        Intent intent;
        try {
            intent = IntentParser.parse(line, sessionId);
        } catch (InvalidOrderException e) {
            reject(e.getReason());
            return;
        }

        int port = ChannelClientSession.peerPort(ctx.channel().remoteAddress());
        try {
            pipeline.submit(intent, () -> logger.info("new {} order {} {}",
                    intent.getSide().label(), port, intent.getCommodity()));
        } catch (InvalidOrderException e) {
            countRejection(e.getReason());
            session.offer(e.getReason().wireText());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            logger.warn("Line too long from {}: {}", peer, cause.getMessage());
            reject(RejectReason.MALFORMED_MESSAGE);
            return;
        }
        logger.warn("Closing connection {}: {}", peer, cause.toString());
        ctx.close();
    }

    private void reject(RejectReason reason) {
        countRejection(reason);
        try {
            pipeline.submitReject(sessionId, reason);
        } catch (InvalidOrderException busy) {
            session.offer(reason.wireText());
        }
    }

    private void countRejection(RejectReason reason) {
        stats.ordersRejected.incrementAndGet();
        metrics.ordersRejectedTotal.labelValues(reason.name().toLowerCase()).inc();
    }
}
