package com.acme.hotdog.router.telemetry;

import com.acme.hotdog.router.util.BuildInfo;
import com.acme.hotdog.router.util.JsonCodec;
import com.acme.hotdog.router.util.RouterDefaults;
import com.acme.hotdog.router.util.StatusCodes;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Status endpoint: {@code /status} answers a JSON health document and
 * {@code /metrics} the counters in Prometheus text format.
 */
public final class StatusHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(StatusHttpEndpoint.class.getName());
    private static final String JSON = "application/json; charset=utf-8";
    private static final String PROMETHEUS = "text/plain; version=0.0.4; charset=utf-8";

    private final AtomicRouterMetrics metrics;
    private final Clock clock;
    private final Instant startedAt;
    private final HttpServer server;
    private final ExecutorService executor;

    public StatusHttpEndpoint(AtomicRouterMetrics metrics, InetSocketAddress bind) throws IOException {
        this(metrics, bind, Clock.systemUTC());
    }

    public StatusHttpEndpoint(AtomicRouterMetrics metrics, InetSocketAddress bind, Clock clock) throws IOException {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
        this.server = HttpServer.create(Objects.requireNonNull(bind, "bind"), 0);
        this.server.createContext("/status", this::handleStatus);
        this.server.createContext("/metrics", this::handleMetrics);
        this.server.createContext("/", exchange -> write(exchange, StatusCodes.NOT_FOUND, "text/plain", "not found\n"));
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hotdog-status-http");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Status endpoint started on " + server.getAddress());
    }

    public int boundPort() {
        return server.getAddress().getPort();
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            write(exchange, StatusCodes.METHOD_NOT_ALLOWED, "text/plain", "method not allowed\n");
            return;
        }
        try {
            String body = renderStatus(metrics.snapshot(), BuildInfo.version(),
                Duration.between(startedAt, clock.instant()));
            write(exchange, StatusCodes.OK, JSON, body);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "status render failed", e);
            write(exchange, StatusCodes.INTERNAL_ERROR, "text/plain", "internal error\n");
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            write(exchange, StatusCodes.METHOD_NOT_ALLOWED, "text/plain", "method not allowed\n");
            return;
        }
        write(exchange, StatusCodes.OK, PROMETHEUS, renderPrometheus(metrics.snapshot()));
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static String renderStatus(AtomicRouterMetrics.Snapshot snapshot, String version, Duration uptime) throws IOException {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("status", "ok");
        doc.put("version", version);
        doc.put("uptimeSeconds", Math.max(0L, uptime.getSeconds()));
        doc.put("bufferDepth", snapshot.bufferDepth());
        doc.put("counters", snapshot.counters());
        return JsonCodec.writeString(doc);
    }

    static String renderPrometheus(AtomicRouterMetrics.Snapshot snapshot) {
        StringBuilder sb = new StringBuilder(RouterDefaults.DEFAULT_METRICS_RENDER_BUFFER);
        String prefix = RouterDefaults.METRICS_PREFIX + "_";
        for (Map.Entry<String, Long> e : snapshot.counters().entrySet()) {
            String name = prefix + e.getKey() + "_total";
            appendHelpType(sb, name, "Total " + e.getKey().replace('_', ' '), "counter");
            sb.append(name).append(' ').append(e.getValue()).append('\n');
        }
        String depth = prefix + "buffer_depth";
        appendHelpType(sb, depth, "Envelopes held by the dispatcher", "gauge");
        sb.append(depth).append(' ').append(snapshot.bufferDepth()).append('\n');
        return sb.toString();
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
