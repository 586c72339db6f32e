package com.acme.hotdog.router.transport;

import com.acme.hotdog.router.config.ListenerSettings;
import com.acme.hotdog.router.telemetry.NoopRouterMetrics;
import com.acme.hotdog.router.telemetry.RouterMetrics;
import com.acme.hotdog.router.util.RouterDefaults;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Newline-delimited syslog over TCP, optionally TLS.
 *
 * <p>Line handling runs on a separate executor group that pins each connection
 * to one thread: lines of a connection are routed in order, connections run in
 * parallel, and a blocked dispatcher stalls only the reads of the connections
 * waiting on it.</p>
 */
public final class SyslogTcpListener implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SyslogTcpListener.class.getName());

    private final ListenerSettings settings;
    private final RoutingPipeline pipeline;
    private final RouterMetrics metrics;
    private final int handlerThreads;
    private final int maxLineBytes;
    private final long drainTimeoutMillis;

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile EventExecutorGroup handlerGroup;
    private volatile ChannelGroup connections;
    private volatile Channel serverChannel;

    public SyslogTcpListener(ListenerSettings settings, RoutingPipeline pipeline, RouterMetrics metrics) {
        this(settings, pipeline, metrics, RouterDefaults.DEFAULT_LISTENER_WORKERS,
            RouterDefaults.DEFAULT_MAX_LINE_BYTES, RouterDefaults.DEFAULT_DRAIN_TIMEOUT_MS);
    }

    public SyslogTcpListener(ListenerSettings settings,
                             RoutingPipeline pipeline,
                             RouterMetrics metrics,
                             int handlerThreads,
                             int maxLineBytes,
                             long drainTimeoutMillis) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.metrics = metrics == null ? NoopRouterMetrics.INSTANCE : metrics;
        this.handlerThreads = Math.max(1, handlerThreads);
        this.maxLineBytes = Math.max(256, maxLineBytes);
        this.drainTimeoutMillis = Math.max(1L, drainTimeoutMillis);
    }

    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }
        SslContext ssl = settings.tlsEnabled()
            ? SslContextBuilder.forServer(settings.tlsCert().toFile(), settings.tlsKey().toFile()).build()
            : null;

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(handlerThreads);
        connections = new DefaultChannelGroup("hotdog-connections", GlobalEventExecutor.INSTANCE);

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, RouterDefaults.DEFAULT_SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc()));
                        }
                        p.addLast(new SyslogLineDecoder(maxLineBytes));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(handlerGroup, new SyslogLineHandler());
                    }
                });

            serverChannel = bootstrap.bind(settings.address(), settings.port()).sync().channel();
            LOG.info(() -> "Syslog listener started on " + serverChannel.localAddress()
                + (ssl != null ? " (tls)" : ""));
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("listener not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    /**
     * Stops accepting, closes open connections and waits for lines already
     * read to finish routing.
     */
    public synchronized void stop() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        ChannelGroup open = connections;
        connections = null;
        if (open != null) {
            open.close().awaitUninterruptibly(drainTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        EventExecutorGroup handlers = handlerGroup;
        handlerGroup = null;
        if (handlers != null) {
            handlers.shutdownGracefully(0, drainTimeoutMillis, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(drainTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully(0, drainTimeoutMillis, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully(0, drainTimeoutMillis, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        LOG.info(() -> "Syslog listener stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private final class SyslogLineHandler extends SimpleChannelInboundHandler<String> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            metrics.incConnections();
            ChannelGroup open = connections;
            if (open != null) {
                open.add(ctx.channel());
            }
            LOG.fine(() -> "connection from " + ctx.channel().remoteAddress());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            if (line.isBlank()) {
                return;
            }
            pipeline.route(line);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof TooLongFrameException) {
                LOG.warning(() -> "discarded line over " + maxLineBytes + " bytes from " + ctx.channel().remoteAddress());
                return;
            }
            LOG.log(Level.WARNING, "closing connection from " + ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
