package com.acme.hotdog.router.record;

import com.acme.hotdog.router.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One inbound log line on its way through the rule set.
 *
 * <p>Owned by a single worker thread for its whole life; not thread-safe.
 * Parsed JSON views are memoized per field, so every query matcher targeting
 * the same field shares one parse. A failed parse is memoized too.</p>
 */
public final class LogRecord {
    private final byte[] raw;
    private final Map<String, String> fields;
    private final Map<String, Optional<JsonNode>> parsedViews = new HashMap<>(4);
    private int parseFailures;

    private ObjectNode structured;
    private String replacement;
    private String destinationTopic;
    private boolean terminated;

    public LogRecord(byte[] raw, Map<String, String> fields) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }

    /**
     * Record whose only field is {@code msg}, holding the whole text.
     */
    public static LogRecord ofMessage(String msg) {
        return new LogRecord(msg.getBytes(StandardCharsets.UTF_8), Map.of(RecordFields.MSG, msg));
    }

    public byte[] raw() {
        return raw;
    }

    public Map<String, String> fields() {
        return fields;
    }

    public String field(String name) {
        return fields.get(name);
    }

    /**
     * JSON view of a field, parsed on first access. Empty when the field is
     * absent or does not hold a single JSON document.
     */
    public Optional<JsonNode> parsedField(String name) {
        Optional<JsonNode> cached = parsedViews.get(name);
        if (cached != null) {
            return cached;
        }
        Optional<JsonNode> parsed = parse(fields.get(name));
        parsedViews.put(name, parsed);
        return parsed;
    }

    private Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = JsonCodec.readTree(text);
            if (node == null || node.isMissingNode()) {
                parseFailures++;
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException notJson) {
            parseFailures++;
            return Optional.empty();
        }
    }

    public int parseFailures() {
        return parseFailures;
    }

    public Optional<ObjectNode> structured() {
        return Optional.ofNullable(structured);
    }

    /**
     * Output document for merges, created on first use. It starts from the
     * parsed view of {@code seedField} when that view is a JSON object.
     */
    public ObjectNode structuredForMerge(String seedField) {
        if (structured == null) {
            Optional<JsonNode> seed = seedField == null ? Optional.empty() : parsedField(seedField);
            structured = seed.filter(JsonNode::isObject)
                .map(node -> (ObjectNode) node)
                .orElseGet(JsonCodec::newObject);
        }
        return structured;
    }

    public Optional<String> replacement() {
        return Optional.ofNullable(replacement);
    }

    public void replacement(String replacement) {
        this.replacement = replacement;
    }

    public Optional<String> destinationTopic() {
        return Optional.ofNullable(destinationTopic);
    }

    public void destinationTopic(String topic) {
        this.destinationTopic = topic;
    }

    public boolean terminated() {
        return terminated;
    }

    public void terminate() {
        this.terminated = true;
    }

    /**
     * Bytes handed to the sink: the replacement text if a replace action ran,
     * else the structured document if one was built, else the raw input.
     */
    public byte[] payload() {
        if (replacement != null) {
            return replacement.getBytes(StandardCharsets.UTF_8);
        }
        if (structured != null) {
            try {
                return JsonCodec.writeBytes(structured);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize structured record", e);
            }
        }
        return raw;
    }

    /**
     * Fresh record with the same input and none of the evaluation state.
     */
    public LogRecord copy() {
        return new LogRecord(raw.clone(), fields);
    }
}
