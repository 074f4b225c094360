package com.orderbookserver.server;

import com.orderbookserver.fanout.ClientSession;
import com.orderbookserver.fanout.DeliveryStatus;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * A client session backed by a Netty channel.
 *
 * The channel's write buffer water mark bounds how much can be queued for a
 * slow reader; once it is unwritable new lines are refused with
 * {@link DeliveryStatus#OVERFLOW}. A failed write closes the channel, which in
 * turn removes the session from the fan-out.
 */
public class ChannelClientSession implements ClientSession {

    private static final Logger logger = LoggerFactory.getLogger(ChannelClientSession.class);

    static final String LINE_SEPARATOR = "\n";

    private final long id;
    private final Channel channel;

    public ChannelClientSession(long id, Channel channel) {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }

    @Override
    public DeliveryStatus offer(String line) {
        if (!channel.isActive()) {
            return DeliveryStatus.CLOSED;
        }
        if (!channel.isWritable()) {
            return DeliveryStatus.OVERFLOW;
        }
        channel.writeAndFlush(line + LINE_SEPARATOR).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.warn("Write to session {} failed: {}", id, String.valueOf(future.cause()));
                future.channel().close();
            }
        });
        return DeliveryStatus.QUEUED;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close();
    }

    /**
     * Host and port of the peer, as logged in connect/disconnect lines.
     */
    static String describePeer(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() != null
                    ? inet.getAddress().getHostAddress() + " " + inet.getPort()
                    : inet.getHostString() + " " + inet.getPort();
        }
        return String.valueOf(address);
    }

    static int peerPort(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            return ((InetSocketAddress) address).getPort();
        }
        return -1;
    }
}
