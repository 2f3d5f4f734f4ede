package com.questrail.sirius.transport.udp.netty;

import com.questrail.sirius.config.DeviceDirectory;
import com.questrail.sirius.transport.DiscoveredDevice;
import com.questrail.sirius.transport.LedTransportException;
import com.questrail.sirius.transport.TransportHandle;
import com.questrail.sirius.transport.TransportPort;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpTransport
 * =============================================================================
 * Netty-backed {@link TransportPort} for LED peripherals reachable as UDP peers
 * (Wi-Fi builds of the firmware, or a BLE gateway that relays datagrams).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. One command line is
 * sent as one datagram. It does not pace, queue, or retry.
 *
 * <h2>Discovery</h2>
 * UDP has no advertisement channel, so discovery answers from a device
 * directory supplied at construction (advertised name to socket address).
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. All handles share one bound datagram channel.
 *
 * <h2>Lifecycle</h2>
 * The channel is bound lazily on the first {@link #connect}. {@link #close()}
 * closes it and shuts down the event loop group.
 */
public final class NettyUdpTransport implements TransportPort
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpTransport.class);

    private final InetSocketAddress bindAddress;
    private final Map<String, InetSocketAddress> directory;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final Object bindLock = new Object();
    private CompletableFuture<Channel> bound;

    /**
     * @param bindAddress local address to bind; port 0 picks an ephemeral port
     * @param directory   advertised device name to peer address
     */
    public NettyUdpTransport(InetSocketAddress bindAddress, Map<String, InetSocketAddress> directory)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.directory = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(directory, "directory")));

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    public NettyUdpTransport(InetSocketAddress bindAddress, DeviceDirectory directory)
    {
        this(bindAddress, Objects.requireNonNull(directory, "directory").byAdvertisedName());
    }

    @Override
    public CompletableFuture<List<DiscoveredDevice>> discover(Duration timeout)
    {
        List<DiscoveredDevice> found = new ArrayList<>();
        directory.forEach((name, address) -> found.add(new DiscoveredDevice(name, formatAddress(address))));
        return CompletableFuture.completedFuture(found);
    }

    @Override
    public CompletableFuture<TransportHandle> connect(String address, Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        final InetSocketAddress remote;
        try {
            remote = parseAddress(address);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new LedTransportException("Bad address: " + address, e));
        }

        return ensureBound().copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(channel -> (TransportHandle) new UdpHandle(channel, remote, address));
    }

    @Override
    public void close()
    {
        CompletableFuture<Channel> b;
        synchronized (bindLock) {
            b = bound;
            bound = null;
        }
        if (b != null && b.isDone() && !b.isCompletedExceptionally()) {
            b.join().close();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * Local address the channel is bound to, once bound.
     */
    InetSocketAddress localAddress()
    {
        CompletableFuture<Channel> b;
        synchronized (bindLock) {
            b = bound;
        }
        if (b == null || !b.isDone() || b.isCompletedExceptionally()) {
            return null;
        }
        return (InetSocketAddress) b.join().localAddress();
    }

    private CompletableFuture<Channel> ensureBound()
    {
        synchronized (bindLock) {
            if (bound != null && !bound.isCompletedExceptionally()) {
                return bound;
            }
            CompletableFuture<Channel> result = new CompletableFuture<>();
            bootstrap.bind(bindAddress).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    result.complete(future.channel());
                }
                else {
                    result.completeExceptionally(
                            new LedTransportException("UDP bind failed on " + bindAddress, future.cause()));
                }
            });
            bound = result;
            return result;
        }
    }

    static InetSocketAddress parseAddress(String address)
    {
        Objects.requireNonNull(address, "address");
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected host:port, got '" + address + "'");
        }
        String host = address.substring(0, colon);
        int port = Integer.parseInt(address.substring(colon + 1));
        return new InetSocketAddress(host, port);
    }

    static String formatAddress(InetSocketAddress address)
    {
        return address.getHostString() + ":" + address.getPort();
    }

    /**
     * UdpHandle
     * -------------------------------------------------------------------------
     * Logical link to one peer over the shared channel. Disconnecting a handle
     * leaves the channel open for the other device.
     */
    private static final class UdpHandle implements TransportHandle
    {
        private final Channel channel;
        private final InetSocketAddress remote;
        private final String address;
        private volatile boolean closed;

        private UdpHandle(Channel channel, InetSocketAddress remote, String address)
        {
            this.channel = channel;
            this.remote = remote;
            this.address = address;
        }

        @Override
        public String address()
        {
            return address;
        }

        @Override
        public boolean isConnected()
        {
            return !closed && channel.isActive();
        }

        @Override
        public CompletableFuture<Void> write(byte[] payload)
        {
            Objects.requireNonNull(payload, "payload");
            if (!isConnected()) {
                return CompletableFuture.failedFuture(new LedTransportException("Link to " + address + " is closed"));
            }

            CompletableFuture<Void> result = new CompletableFuture<>();
            DatagramPacket pkt = new DatagramPacket(Unpooled.wrappedBuffer(payload), remote);
            channel.writeAndFlush(pkt).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    result.complete(null);
                }
                else {
                    result.completeExceptionally(
                            new LedTransportException("Datagram to " + address + " failed", future.cause()));
                }
            });
            return result;
        }

        @Override
        public CompletableFuture<Void> disconnect()
        {
            closed = true;
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * The firmware does not answer commands; anything received is logged and
     * dropped (the base class releases the buffer).
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            log.debug("Ignoring {} byte datagram from {}", packet.content().readableBytes(), packet.sender());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("UDP channel error", cause);
        }
    }
}
