package com.orderbookserver.server;

import com.orderbookserver.config.ServerConfig;
import com.orderbookserver.disruptor.IntentPipeline;
import com.orderbookserver.fanout.NotificationFanout;
import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.metrics.MetricsRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP front end: accepts connections and frames newline-terminated order
 * lines.
 *
 * Pipeline per connection:
 * <ol>
 *   <li>{@link LineBasedFrameDecoder}: splits on '\n', strips the terminator</li>
 *   <li>{@link StringDecoder} / {@link StringEncoder}: UTF-8 text</li>
 *   <li>{@link OrderLineHandler}: parse, submit, register for broadcasts</li>
 * </ol>
 *
 * If the configured address cannot be bound the server falls back to an
 * ephemeral port on 127.0.0.1.
 */
public class ExchangeServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeServer.class);

    public static final int MAX_LINE_LENGTH = 1024;
    private static final String FALLBACK_HOST = "127.0.0.1";

    private final ServerConfig config;
    private final IntentPipeline pipeline;
    private final NotificationFanout fanout;
    private final ExchangeStats stats;
    private final MetricsRegistry metrics;
    private final AtomicLong sessionIds = new AtomicLong();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ExchangeServer(ServerConfig config, IntentPipeline pipeline, NotificationFanout fanout,
                          ExchangeStats stats, MetricsRegistry metrics) {
        this.config = config;
        this.pipeline = pipeline;
        this.fanout = fanout;
        this.stats = stats;
        this.metrics = metrics;
    }

    /**
     * Bind and start accepting connections.
     *
     * @return the address actually bound
     */
    public InetSocketAddress start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                        config.getOutboundHighWaterMark() / 2, config.getOutboundHighWaterMark()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new LineBasedFrameDecoder(MAX_LINE_LENGTH),
                                new StringDecoder(StandardCharsets.UTF_8),
                                new StringEncoder(StandardCharsets.UTF_8),
                                new OrderLineHandler(sessionIds.incrementAndGet(),
                                        pipeline, fanout, stats, metrics));
                    }
                });

        InetSocketAddress requested = new InetSocketAddress(config.getListenHost(), config.getListenPort());
        ChannelFuture bind = b.bind(requested).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            bind = b.bind(new InetSocketAddress(FALLBACK_HOST, 0)).syncUninterruptibly();
            int port = ((InetSocketAddress) bind.channel().localAddress()).getPort();
            logger.warn("Not able to use {}:{}, fallback to {}:{}.",
                    config.getListenHost(), config.getListenPort(), FALLBACK_HOST, port);
        }
        serverChannel = bind.channel();

        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        logger.info("listening on port {}", bound.getPort());
        return bound;
    }

    /**
     * Block until the server channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
        }
    }
}
