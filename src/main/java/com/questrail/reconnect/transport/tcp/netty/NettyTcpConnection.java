package com.questrail.reconnect.transport.tcp.netty;

import com.questrail.reconnect.api.ReconnectableConnection;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.AttributeKey;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * NettyTcpConnection
 * =============================================================================
 * Netty-backed TCP client implementing {@link ReconnectableConnection}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It connects, reports
 * drops and tears down. It MUST NOT retry or count failures.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]}
 * and handed to the inbound listener.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #establish()} opens a new channel to the remote address.</li>
 *   <li>{@link #awaitDrop()} blocks on the channel's close future. An orderly
 *       close returns normally; a pipeline exception is rethrown.</li>
 *   <li>{@link #terminate()} cancels a pending connect, closes the channel and
 *       shuts down the event loop group. A terminated connection stays
 *       terminated: establish fails fast and awaitDrop returns at once.</li>
 * </ul>
 */
public final class NettyTcpConnection implements ReconnectableConnection
{
    private static final AttributeKey<Throwable> FAILURE = AttributeKey.valueOf("reconnect.failure");

    private final InetSocketAddress remoteAddress;
    private final Consumer<byte[]> inboundListener;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final Object lock = new Object();
    private volatile boolean terminated;
    private ChannelFuture pendingConnect;
    private volatile Channel channel;

    public NettyTcpConnection(InetSocketAddress remoteAddress) {
        this(remoteAddress, Duration.ofSeconds(10), payload -> {});
    }

    /**
     * Construct a Netty TCP connection to the specified remote address.
     *
     * <p>A dedicated single-threaded {@link NioEventLoopGroup} keeps the adapter
     * self-contained; it lives until {@link #terminate()}.</p>
     *
     * @param connectTimeout upper bound for a single {@link #establish()}
     * @param inboundListener receives inbound bytes on the Netty event loop
     */
    public NettyTcpConnection(InetSocketAddress remoteAddress,
                              Duration connectTimeout,
                              Consumer<byte[]> inboundListener)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.inboundListener = Objects.requireNonNull(inboundListener, "inboundListener");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void establish() throws Exception
    {
        ChannelFuture connect;
        synchronized (lock) {
            if (terminated) {
                throw new ClosedChannelException();
            }
            Channel previous = channel;
            if (previous != null) {
                previous.close();
                channel = null;
            }
            connect = bootstrap.connect(remoteAddress);
            pendingConnect = connect;
        }

        try {
            connect.await();
        } finally {
            synchronized (lock) {
                pendingConnect = null;
            }
        }

        if (!connect.isSuccess()) {
            if (connect.isCancelled()) {
                throw new ClosedChannelException();
            }
            throw asException(connect.cause());
        }

        synchronized (lock) {
            if (terminated) {
                connect.channel().close();
                throw new ClosedChannelException();
            }
            channel = connect.channel();
        }
    }

    @Override
    public void awaitDrop() throws Exception
    {
        if (terminated) {
            return;
        }
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("awaitDrop() called without an established connection");
        }

        ch.closeFuture().await();

        Throwable cause = ch.attr(FAILURE).get();
        if (cause != null && !terminated) {
            throw asException(cause);
        }
    }

    @Override
    public void terminate() throws Exception
    {
        ChannelFuture pending;
        Channel ch;
        synchronized (lock) {
            terminated = true;
            pending = pendingConnect;
            ch = channel;
        }

        if (pending != null) {
            pending.cancel(false);
        }

        try {
            if (ch != null) {
                ChannelFuture closed = ch.close().awaitUninterruptibly();
                if (!closed.isSuccess()) {
                    throw asException(closed.cause());
                }
            }
        } finally {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    /**
     * Writes a payload on the current connection.
     *
     * @return {@code false} if there is no open connection; the caller decides
     *         whether to drop or buffer the payload
     */
    public boolean send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(Unpooled.wrappedBuffer(payload));
        return true;
    }

    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private static Exception asException(Throwable cause)
    {
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return new IOException(cause);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies inbound bytes out of Netty and records the first pipeline failure
     * so {@link #awaitDrop()} can report it.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            inboundListener.accept(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            ctx.channel().attr(FAILURE).setIfAbsent(cause);
            ctx.close();
        }
    }
}
