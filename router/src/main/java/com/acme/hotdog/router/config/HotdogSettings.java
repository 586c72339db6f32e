package com.acme.hotdog.router.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw shape of the YAML configuration document.
 *
 * <p>Values are unvalidated; {@link SettingsLoader} checks them and
 * {@link com.acme.hotdog.router.rules.RuleSetCompiler} turns {@link #rules()}
 * into a compiled rule set.</p>
 */
public record HotdogSettings(Global global, List<RuleDefinition> rules) {

    public HotdogSettings {
        rules = copyOf(rules);
    }

    public record Global(Listen listen, Status status, Kafka kafka, Metrics metrics) {}

    public record Listen(String address, Integer port, Tls tls) {}

    public record Tls(String cert, String key) {}

    public record Status(String address, Integer port) {}

    public record Kafka(Integer buffer, Map<String, Object> conf, String topic) {
        public Kafka {
            conf = conf == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conf));
        }
    }

    public record Metrics(String statsd) {}

    /**
     * One entry of {@code rules[]}. Exactly one of {@code jmespath} and {@code regex} is set.
     */
    public record RuleDefinition(String jmespath, String regex, String field, List<ActionDefinition> actions) {
        public RuleDefinition {
            actions = copyOf(actions);
        }
    }

    /**
     * One entry of {@code rules[].actions[]}, discriminated by {@code type}.
     */
    public record ActionDefinition(String type, JsonNode json, String topic, String template) {}

    // keeps null entries (a bare "-" in YAML) so the compiler can report them by index
    private static <T> List<T> copyOf(List<T> items) {
        return items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }
}
