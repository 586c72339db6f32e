package com.acme.hotdog.router.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Shared JSON and YAML codecs.
 *
 * <p>{@link ObjectMapper} instances are thread-safe once configured, so the hot
 * path shares one for record payloads.</p>
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static byte[] writeBytes(JsonNode value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    public static JsonNode valueToTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static <T> T readYaml(InputStream in, Class<T> type) throws IOException {
        return YAML_MAPPER.readValue(in, type);
    }

    public static <T> T readYaml(String raw, Class<T> type) throws IOException {
        return YAML_MAPPER.readValue(raw, type);
    }
}
