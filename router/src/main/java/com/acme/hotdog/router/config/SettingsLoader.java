package com.acme.hotdog.router.config;

import com.acme.hotdog.router.rules.RuleSet;
import com.acme.hotdog.router.rules.RuleSetCompiler;
import com.acme.hotdog.router.rules.RuntimeValues;
import com.acme.hotdog.router.template.TemplateEngine;
import com.acme.hotdog.router.util.JsonCodec;
import com.acme.hotdog.router.util.RouterDefaults;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the YAML configuration document, validates it and compiles its rules.
 * Any problem surfaces as a {@link ConfigurationException}.
 */
public final class SettingsLoader {
    private static final Logger LOG = Logger.getLogger(SettingsLoader.class.getName());

    static final String DEFAULT_LISTEN_ADDRESS = "127.0.0.1";
    static final int DEFAULT_LISTEN_PORT = 1514;
    static final String DEFAULT_STATUS_ADDRESS = "127.0.0.1";
    static final int DEFAULT_STATUS_PORT = 8585;

    private final RuntimeValues runtime;
    private final TemplateEngine templates;

    public SettingsLoader(RuntimeValues runtime) {
        this(runtime, new TemplateEngine());
    }

    public SettingsLoader(RuntimeValues runtime, TemplateEngine templates) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    public HotdogConfig load(Path file) {
        HotdogSettings raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = JsonCodec.readYaml(in, HotdogSettings.class);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("configuration file not found: " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read " + file + ": " + e.getMessage(), e);
        }
        HotdogConfig config = fromSettings(raw);
        LOG.info(() -> "Loaded " + config.ruleSet().rules().size() + " rules from " + file);
        return config;
    }

    public HotdogConfig parse(String yaml) {
        HotdogSettings raw;
        try {
            raw = JsonCodec.readYaml(yaml, HotdogSettings.class);
        } catch (IOException e) {
            throw new ConfigurationException("invalid configuration document: " + e.getMessage(), e);
        }
        return fromSettings(raw);
    }

    HotdogConfig fromSettings(HotdogSettings raw) {
        if (raw == null || raw.global() == null) {
            throw new ConfigurationException("global section is required");
        }
        HotdogSettings.Global global = raw.global();
        HotdogSettings.Kafka kafka = global.kafka();
        if (kafka == null) {
            throw new ConfigurationException("global.kafka section is required");
        }
        String topic = kafka.topic();
        if (topic == null || topic.isBlank()) {
            throw new ConfigurationException("global.kafka.topic is required");
        }
        RouterSettings settings = new RouterSettings(
            listener(global.listen()),
            status(global.status()),
            buffer(kafka.buffer()),
            producerConfig(kafka.conf()),
            topic,
            statsd(global.metrics())
        );
        RuleSet ruleSet = new RuleSetCompiler(templates, runtime).compile(raw.rules(), topic);
        return new HotdogConfig(settings, ruleSet);
    }

    private static ListenerSettings listener(HotdogSettings.Listen listen) {
        if (listen == null) {
            return new ListenerSettings(DEFAULT_LISTEN_ADDRESS, DEFAULT_LISTEN_PORT, null, null);
        }
        String address = blankToDefault(listen.address(), DEFAULT_LISTEN_ADDRESS);
        int port = port("global.listen.port", listen.port(), DEFAULT_LISTEN_PORT);
        HotdogSettings.Tls tls = listen.tls();
        if (tls == null) {
            return new ListenerSettings(address, port, null, null);
        }
        boolean hasCert = tls.cert() != null && !tls.cert().isBlank();
        boolean hasKey = tls.key() != null && !tls.key().isBlank();
        if (hasCert != hasKey) {
            throw new ConfigurationException("global.listen.tls requires both cert and key");
        }
        if (!hasCert) {
            return new ListenerSettings(address, port, null, null);
        }
        Path cert = readable("global.listen.tls.cert", tls.cert());
        Path key = readable("global.listen.tls.key", tls.key());
        return new ListenerSettings(address, port, cert, key);
    }

    private static Path readable(String where, String value) {
        Path path = Path.of(value);
        if (!Files.isReadable(path)) {
            throw new ConfigurationException(where + ": cannot read " + value);
        }
        return path;
    }

    private static InetSocketAddress status(HotdogSettings.Status status) {
        if (status == null) {
            return new InetSocketAddress(DEFAULT_STATUS_ADDRESS, DEFAULT_STATUS_PORT);
        }
        return new InetSocketAddress(
            blankToDefault(status.address(), DEFAULT_STATUS_ADDRESS),
            port("global.status.port", status.port(), DEFAULT_STATUS_PORT));
    }

    private static int buffer(Integer buffer) {
        if (buffer == null) {
            return RouterDefaults.DEFAULT_BUFFER;
        }
        if (buffer < 1) {
            throw new ConfigurationException("global.kafka.buffer must be >= 1, got " + buffer);
        }
        return buffer;
    }

    private static Map<String, String> producerConfig(Map<String, Object> conf) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : conf.entrySet()) {
            if (e.getValue() == null) {
                throw new ConfigurationException("global.kafka.conf." + e.getKey() + " has no value");
            }
            out.put(e.getKey(), String.valueOf(e.getValue()));
        }
        return out;
    }

    private static InetSocketAddress statsd(HotdogSettings.Metrics metrics) {
        if (metrics == null || metrics.statsd() == null || metrics.statsd().isBlank()) {
            return null;
        }
        return hostPort("global.metrics.statsd", metrics.statsd().trim());
    }

    static InetSocketAddress hostPort(String where, String value) {
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new ConfigurationException(where + ": expected host:port, got '" + value + "'");
        }
        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(where + ": invalid port in '" + value + "'", e);
        }
        return InetSocketAddress.createUnresolved(host, port(where, port, port));
    }

    private static int port(String where, Integer value, int defaultValue) {
        int port = value == null ? defaultValue : value;
        if (port < 0 || port > 65_535) {
            throw new ConfigurationException(where + " out of range: " + port);
        }
        return port;
    }

    private static String blankToDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
