package com.questrail.realm.engine.transport.netty;

import com.questrail.realm.engine.transport.LineEndpoint;
import com.questrail.realm.engine.transport.LineEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NettyTcpLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames inbound bytes
 * into UTF-8 lines and writes outbound lines; nothing else.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Connections are identified to the listener by
 * the channel's short id text.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LineBasedFrameDecoder(maxLineLength) → StringDecoder(UTF-8) → InboundHandler
 *   StringEncoder(UTF-8)
 * </pre>
 * Lines longer than {@code maxLineLength} close the connection.
 */
public final class NettyTcpLineEndpoint implements LineEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineEndpoint.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 1024;

    private final InetSocketAddress bindAddress;
    private final int maxLineLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final Map<String, Channel> connections = new ConcurrentHashMap<>();

    private volatile LineEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpLineEndpoint(InetSocketAddress bindAddress) {
        this(bindAddress, DEFAULT_MAX_LINE_LENGTH);
    }

    public NettyTcpLineEndpoint(InetSocketAddress bindAddress, int maxLineLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0");
        }
        this.maxLineLength = maxLineLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(NettyTcpLineEndpoint.this.maxLineLength));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        LineEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        LineEndpointListener l = listener;

        Channel server = serverChannel;
        if (server != null) {
            server.close().syncUninterruptibly();
        }
        for (Channel ch : connections.values()) {
            ch.close();
        }

        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();

        if (l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public void send(String connectionId, String line)
    {
        Objects.requireNonNull(line, "line");
        Channel ch = connectionId == null ? null : connections.get(connectionId);
        if (ch == null || !ch.isActive()) {
            return;
        }
        ch.writeAndFlush(line + "\n");
    }

    @Override
    public void close(String connectionId)
    {
        Channel ch = connectionId == null ? null : connections.get(connectionId);
        if (ch != null) {
            ch.close();
        }
    }

    /**
     * Bound address once {@link #start()} has succeeded. Useful when binding to
     * port 0.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel server = serverChannel;
        return server == null ? Optional.empty() : Optional.of((InetSocketAddress) server.localAddress());
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    // The short form of a channel id is not unique across channels.
    static String connectionId(Channel channel) {
        return channel.id().asLongText();
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * One per connection. Forwards decoded lines and open/close notices to the
     * port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            String id = connectionId(ctx.channel());
            connections.put(id, ctx.channel());
            LineEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(id, ctx.channel().remoteAddress());
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            LineEndpointListener l = listener;
            if (l != null) {
                l.onLine(connectionId(ctx.channel()), line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            String id = connectionId(ctx.channel());
            connections.remove(id);
            LineEndpointListener l = listener;
            if (l != null) {
                l.onConnectionClosed(id);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing connection {} after error", connectionId(ctx.channel()), cause);
            ctx.close();
        }
    }
}
