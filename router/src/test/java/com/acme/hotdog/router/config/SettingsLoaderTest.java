package com.acme.hotdog.router.config;

import com.acme.hotdog.router.rules.RuntimeValues;
import com.acme.hotdog.router.util.RouterDefaults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsLoaderTest {
    private final SettingsLoader loader = new SettingsLoader(new RuntimeValues("test", Clock.systemUTC()));

    private String failure(String yaml) {
        return assertThrows(ConfigurationException.class, () -> loader.parse(yaml)).getMessage();
    }

    @Test
    void shouldLoadFullDocument(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("hotdog.yml");
        Files.writeString(file, """
            global:
              listen:
                address: '0.0.0.0'
                port: 6514
              status:
                address: '127.0.0.1'
                port: 9595
              kafka:
                buffer: 16
                conf:
                  bootstrap.servers: '127.0.0.1:9092'
                  linger.ms: 5
                topic: 'logs'
              metrics:
                statsd: 'localhost:8125'
            rules:
              - regex: '.*'
                field: msg
                actions:
                  - type: stop
            """, StandardCharsets.UTF_8);

        HotdogConfig config = loader.load(file);
        RouterSettings settings = config.settings();

        assertEquals("0.0.0.0", settings.listener().address());
        assertEquals(6514, settings.listener().port());
        assertFalse(settings.listener().tlsEnabled());
        assertEquals(9595, settings.statusAddress().getPort());
        assertEquals(16, settings.buffer());
        assertEquals(Map.of("bootstrap.servers", "127.0.0.1:9092", "linger.ms", "5"), settings.producerConfig());
        assertEquals("logs", settings.defaultTopic());
        assertEquals(InetSocketAddress.createUnresolved("localhost", 8125), settings.statsd());
        assertEquals(1, config.ruleSet().rules().size());
    }

    @Test
    void shouldApplyDefaults() {
        RouterSettings settings = loader.parse("""
            global:
              kafka:
                topic: logs
            """).settings();

        assertEquals(SettingsLoader.DEFAULT_LISTEN_ADDRESS, settings.listener().address());
        assertEquals(SettingsLoader.DEFAULT_LISTEN_PORT, settings.listener().port());
        assertEquals(SettingsLoader.DEFAULT_STATUS_PORT, settings.statusAddress().getPort());
        assertEquals(RouterDefaults.DEFAULT_BUFFER, settings.buffer());
        assertTrue(settings.producerConfig().isEmpty());
        assertNull(settings.statsd());
    }

    @Test
    void shouldAcceptTlsWithBothFiles(@TempDir Path dir) throws Exception {
        Path cert = Files.writeString(dir.resolve("cert.pem"), "cert");
        Path key = Files.writeString(dir.resolve("key.pem"), "key");

        ListenerSettings listener = loader.parse("""
            global:
              listen:
                tls:
                  cert: '%s'
                  key: '%s'
              kafka:
                topic: logs
            """.formatted(cert, key)).settings().listener();

        assertTrue(listener.tlsEnabled());
        assertEquals(cert, listener.tlsCert());
    }

    @Test
    void shouldRejectGlobalErrors() {
        assertTrue(failure("rules: []").contains("global section is required"));
        assertTrue(failure("global: {listen: {port: 1}}").contains("global.kafka section is required"));
        assertTrue(failure("global: {kafka: {buffer: 4}}").contains("global.kafka.topic is required"));
        assertTrue(failure("global: {kafka: {topic: t, buffer: 0}}").contains("global.kafka.buffer must be >= 1"));
        assertTrue(failure("global: {kafka: {topic: t}, listen: {port: 70000}}").contains("global.listen.port out of range"));
        assertTrue(failure("global: {kafka: {topic: t}, listen: {tls: {cert: a.pem}}}").contains("both cert and key"));
        assertTrue(failure("global: {kafka: {topic: t}, listen: {tls: {cert: /nope/a.pem, key: /nope/b.pem}}}")
            .contains("cannot read /nope/a.pem"));
        assertTrue(failure("global: {kafka: {topic: t}, metrics: {statsd: 'localhost'}}").contains("expected host:port"));
        assertTrue(failure("global: {kafka: {topic: t}, metrics: {statsd: 'localhost:abc'}}").contains("invalid port"));
    }

    @Test
    void shouldRejectMalformedDocumentAndRules() {
        assertTrue(failure("global: [unclosed").startsWith("invalid configuration document"));
        assertTrue(failure("""
            global: {kafka: {topic: t}}
            rules:
              - regex: '['
                field: msg
                actions: [{type: stop}]
            """).startsWith("rules[0]: invalid regex"));
    }

    @Test
    void shouldReportBareListEntriesByIndex() {
        assertTrue(failure("""
            global: {kafka: {topic: t}}
            rules:
              - regex: '.*'
                field: msg
                actions: [{type: stop}]
              -
            """).contains("rules[1]: empty rule"));
        assertTrue(failure("""
            global: {kafka: {topic: t}}
            rules:
              - regex: '.*'
                field: msg
                actions:
                  -
            """).contains("rules[0].actions[0]: type is required"));
    }

    @Test
    void shouldReportMissingFile(@TempDir Path dir) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> loader.load(dir.resolve("absent.yml")));
        assertTrue(e.getMessage().startsWith("configuration file not found"));
    }

    @Test
    void shouldParseBracketedIpv6StatsdAddress() {
        InetSocketAddress address = SettingsLoader.hostPort("x", "[::1]:8125");
        assertEquals("::1", address.getHostString());
        assertEquals(8125, address.getPort());
    }
}
