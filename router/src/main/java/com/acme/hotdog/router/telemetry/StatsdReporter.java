package com.acme.hotdog.router.telemetry;

import com.acme.hotdog.router.util.RouterDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Pushes counter deltas and the buffer depth gauge to a StatsD collector over UDP.
 */
public final class StatsdReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(StatsdReporter.class.getName());

    private final AtomicRouterMetrics metrics;
    private final InetSocketAddress target;
    private final long intervalSeconds;
    private final ScheduledExecutorService executor;
    private final EventLoopGroup group;
    private final Map<String, Long> lastSent = new HashMap<>();
    private Channel channel;

    public StatsdReporter(AtomicRouterMetrics metrics, InetSocketAddress target, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.target = resolve(Objects.requireNonNull(target, "target"));
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.group = new NioEventLoopGroup(1);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hotdog-statsd-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    private static InetSocketAddress resolve(InetSocketAddress address) {
        return address.isUnresolved() ? new InetSocketAddress(address.getHostString(), address.getPort()) : address;
    }

    public void start() throws InterruptedException {
        channel = new Bootstrap()
            .group(group)
            .channel(NioDatagramChannel.class)
            .handler(new ChannelInboundHandlerAdapter())
            .bind(0)
            .sync()
            .channel();
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("StatsD reporter sending to " + target + " every " + intervalSeconds + "s");
    }

    private void emit() {
        try {
            String payload = render(metrics.snapshot(), lastSent);
            if (payload.isEmpty() || channel == null) {
                return;
            }
            channel.writeAndFlush(new DatagramPacket(Unpooled.copiedBuffer(payload, StandardCharsets.UTF_8), target));
        } catch (Throwable t) {
            LOG.warning("StatsD reporter failure: " + t.getClass().getSimpleName());
        }
    }

    /**
     * StatsD lines for counters that moved since {@code previous}, plus the
     * gauge. Updates {@code previous} to the snapshot values.
     */
    static String render(AtomicRouterMetrics.Snapshot snapshot, Map<String, Long> previous) {
        StringBuilder sb = new StringBuilder(RouterDefaults.DEFAULT_METRICS_RENDER_BUFFER);
        String prefix = RouterDefaults.METRICS_PREFIX + ".";
        for (Map.Entry<String, Long> e : snapshot.counters().entrySet()) {
            long before = previous.getOrDefault(e.getKey(), 0L);
            long delta = e.getValue() - before;
            previous.put(e.getKey(), e.getValue());
            if (delta > 0) {
                sb.append(prefix).append(e.getKey()).append(':').append(delta).append("|c\n");
            }
        }
        sb.append(prefix).append("buffer_depth:").append(snapshot.bufferDepth()).append("|g\n");
        return sb.toString();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        if (channel != null) {
            channel.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
