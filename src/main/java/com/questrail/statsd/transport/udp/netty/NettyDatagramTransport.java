package com.questrail.statsd.transport.udp.netty;

import com.questrail.statsd.codec.ByteView;
import com.questrail.statsd.resolve.StatsdEndpoint;
import com.questrail.statsd.transport.DatagramTransport;
import com.questrail.statsd.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyDatagramTransport
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT split,
 * batch, retry or interpret payloads.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ChannelFuture}, {@code ByteBuf})
 * MUST NOT escape this package. Payloads arrive as {@link ByteView} and are
 * wrapped, not copied; completion leaves as {@link CompletableFuture}.
 *
 * <h2>Lifecycle</h2>
 * - The constructor binds an IPv4 UDP channel and fails with
 *   {@link TransportException} if the bind fails.
 * - {@link #close()} closes the channel, and shuts down the event loop group
 *   only if this transport created it.
 *
 * <h2>Threading</h2>
 * Writes complete on the channel's event loop. {@link #send(ByteView)} waits
 * for that completion and therefore must not be called from the event loop
 * itself.
 */
public final class NettyDatagramTransport implements DatagramTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyDatagramTransport.class);

    private final StatsdEndpoint endpoint;
    private final InetSocketAddress recipient;

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final Channel channel;

    private final AtomicBoolean open = new AtomicBoolean(true);

    /**
     * Open a transport on an ephemeral local port with a dedicated,
     * single-threaded event loop group.
     */
    public NettyDatagramTransport(StatsdEndpoint endpoint)
    {
        this(endpoint, new InetSocketAddress("0.0.0.0", 0));
    }

    public NettyDatagramTransport(StatsdEndpoint endpoint, InetSocketAddress bindAddress)
    {
        this(endpoint, bindAddress, new NioEventLoopGroup(1), true);
    }

    /**
     * Open a transport on a caller-supplied event loop group. The group is
     * not shut down by {@link #close()}.
     */
    public NettyDatagramTransport(StatsdEndpoint endpoint, InetSocketAddress bindAddress, EventLoopGroup group)
    {
        this(endpoint, bindAddress, group, false);
    }

    private NettyDatagramTransport(StatsdEndpoint endpoint,
                                   InetSocketAddress bindAddress,
                                   EventLoopGroup group,
                                   boolean ownsGroup)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.recipient = endpoint.toSocketAddress();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channelFactory(new Ipv4ChannelFactory())
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        ChannelFuture bound = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            if (ownsGroup) {
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            }
            throw new TransportException("Unable to open UDP socket on " + bindAddress, bound.cause());
        }

        this.channel = bound.channel();
    }

    @Override
    public StatsdEndpoint endpoint()
    {
        return endpoint;
    }

    @Override
    public void send(ByteView payload)
    {
        ChannelFuture written = write(payload).awaitUninterruptibly();
        if (!written.isSuccess()) {
            throw sendFailure(written.cause());
        }
    }

    @Override
    public CompletableFuture<Void> sendAsync(ByteView payload)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();

        final ChannelFuture written;
        try {
            written = write(payload);
        } catch (TransportException e) {
            result.completeExceptionally(e);
            return result;
        }

        written.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(sendFailure(future.cause()));
            }
        });
        return result;
    }

    @Override
    public boolean isOpen()
    {
        return open.get() && channel.isOpen();
    }

    @Override
    public void close()
    {
        if (!open.compareAndSet(true, false)) {
            return;
        }

        try {
            channel.close().awaitUninterruptibly();
        }
        finally {
            if (ownsGroup) {
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            }
        }
    }

    /** Local address the channel is bound to. */
    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) channel.localAddress();
    }

    @Override
    public String toString()
    {
        return "[udp] " + endpoint;
    }

    private ChannelFuture write(ByteView payload)
    {
        Objects.requireNonNull(payload, "payload");

        if (!open.get()) {
            throw new TransportException("Transport to " + endpoint + " is closed");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload.array(), payload.offset(), payload.length());
        return channel.writeAndFlush(new DatagramPacket(buf, recipient));
    }

    private TransportException sendFailure(Throwable cause)
    {
        return new TransportException("Send to " + endpoint + " failed", cause);
    }

    /**
     * Opens the channel for the IPv4 family only; the endpoint is always IPv4.
     */
    private static final class Ipv4ChannelFactory implements ChannelFactory<NioDatagramChannel>
    {
        @Override
        public NioDatagramChannel newChannel()
        {
            return new NioDatagramChannel(InternetProtocolFamily.IPv4);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * The collector never replies; anything received is released and dropped.
     * Channel-level exceptions are not tied to any caller's send, so they are
     * logged here. Failed writes are reported through their own futures.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            log.debug("Dropping unexpected {}-byte datagram from {}",
                    packet.content().readableBytes(), packet.sender());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("UDP channel to {} reported an error", endpoint, cause);
        }
    }
}
