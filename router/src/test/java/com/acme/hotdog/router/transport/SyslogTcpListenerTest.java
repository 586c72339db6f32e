package com.acme.hotdog.router.transport;

import com.acme.hotdog.router.config.ListenerSettings;
import com.acme.hotdog.router.config.SettingsLoader;
import com.acme.hotdog.router.dispatch.Backoff;
import com.acme.hotdog.router.dispatch.Dispatcher;
import com.acme.hotdog.router.dispatch.Envelope;
import com.acme.hotdog.router.dispatch.RecordingSink;
import com.acme.hotdog.router.record.SyslogParser;
import com.acme.hotdog.router.rules.RuleSet;
import com.acme.hotdog.router.rules.RuntimeValues;
import com.acme.hotdog.router.telemetry.AtomicRouterMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyslogTcpListenerTest {
    private static final String RULES = """
        global:
          kafka:
            topic: logs-default
        rules:
          - regex: 'level=(?P<level>\\w+)'
            field: msg
            actions:
              - type: forward
                topic: 'logs-{{level}}'
        """;

    private final AtomicRouterMetrics metrics = new AtomicRouterMetrics();
    private SyslogTcpListener listener;
    private Dispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (listener != null) {
            listener.close();
        }
        if (dispatcher != null) {
            dispatcher.stopAndDrain(Duration.ofSeconds(5));
        }
    }

    private int start(RecordingSink sink) throws Exception {
        RuleSet ruleSet = new SettingsLoader(RuntimeValues.system()).parse(RULES).ruleSet();
        dispatcher = new Dispatcher(16, sink, new Backoff(1, 2), metrics);
        dispatcher.start();
        RoutingPipeline pipeline = new RoutingPipeline(new SyslogParser(), ruleSet, dispatcher, metrics);
        listener = new SyslogTcpListener(new ListenerSettings("127.0.0.1", 0, null, null),
            pipeline, metrics, 2, 256, 2_000);
        listener.start();
        return listener.boundPort();
    }

    private static void send(int port, String payload) throws Exception {
        try (Socket socket = new Socket("127.0.0.1", port)) {
            OutputStream out = socket.getOutputStream();
            out.write(payload.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    @Test
    void shouldRouteEachLineInArrivalOrder() throws Exception {
        RecordingSink sink = RecordingSink.open().expect(3);
        int port = start(sink);

        send(port, "<11>1 - web01 api - - - level=error disk full\n"
            + "\n"
            + "<14>1 - web01 api - - - level=info started\r\n"
            + "no level here\n");

        assertTrue(sink.awaitExpected(5));
        List<String> topics = sink.delivered().stream().map(Envelope::topic).toList();
        assertEquals(List.of("logs-error", "logs-info", "logs-default"), topics);
        assertEquals(1L, metrics.snapshot().connections());
        assertEquals(3L, metrics.snapshot().lines());
    }

    @Test
    void shouldDropOversizedLineAndKeepConnection() throws Exception {
        RecordingSink sink = RecordingSink.open().expect(1);
        int port = start(sink);

        send(port, "x".repeat(1_000) + "\nlevel=warn after the long one\n");

        assertTrue(sink.awaitExpected(5));
        assertEquals("logs-warn", sink.delivered().get(0).topic());
        assertEquals("level=warn after the long one",
            new String(sink.delivered().get(0).payload(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldRouteUnterminatedLastLineWhenPeerCloses() throws Exception {
        RecordingSink sink = RecordingSink.open().expect(2);
        int port = start(sink);

        send(port, "level=info first\nlevel=warn second without newline");

        assertTrue(sink.awaitExpected(5));
        assertEquals(List.of("logs-info", "logs-warn"), sink.delivered().stream().map(Envelope::topic).toList());
        assertEquals("level=warn second without newline",
            new String(sink.delivered().get(1).payload(), StandardCharsets.UTF_8));
        assertEquals(2L, metrics.snapshot().lines());
    }
}
