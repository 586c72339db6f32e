package com.acme.hotdog.router.template;

import com.acme.hotdog.router.util.JsonCodec;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonMergeTest {

    private static ObjectNode obj(String json) throws Exception {
        return (ObjectNode) JsonCodec.readTree(json);
    }

    @Test
    void shouldUnifyNestedObjectsAndKeepExistingKeys() throws Exception {
        ObjectNode target = obj("{\"meta\":{\"topic\":\"foo\"}}");
        JsonMerge.deepMerge(target, obj("{\"meta\":{\"hotdog\":{\"version\":\"1\"}}}"));

        assertEquals(obj("{\"meta\":{\"topic\":\"foo\",\"hotdog\":{\"version\":\"1\"}}}"), target);
    }

    @Test
    void shouldOverwriteScalarsAndArraysWithoutAppending() throws Exception {
        ObjectNode target = obj("{\"a\":1,\"list\":[1,2],\"o\":{\"x\":1}}");
        JsonMerge.deepMerge(target, obj("{\"a\":\"two\",\"list\":[3],\"o\":5}"));

        assertEquals(obj("{\"a\":\"two\",\"list\":[3],\"o\":5}"), target);
    }

    @Test
    void shouldBeIdempotentForTheSamePatch() throws Exception {
        ObjectNode patch = obj("{\"a\":{\"b\":[1,2],\"c\":\"x\"}}");
        ObjectNode once = JsonMerge.deepMerge(obj("{\"z\":0}"), patch);
        ObjectNode twice = JsonMerge.deepMerge(JsonMerge.deepMerge(obj("{\"z\":0}"), patch), patch);

        assertEquals(once, twice);
    }

    @Test
    void shouldNotAliasPatchNodes() throws Exception {
        ObjectNode patch = obj("{\"a\":{\"b\":1}}");
        ObjectNode target = JsonMerge.deepMerge(JsonCodec.newObject(), patch);
        ((ObjectNode) target.get("a")).put("b", 2);

        assertEquals(1, patch.get("a").get("b").asInt());
    }

    @Test
    void shouldKeepPatchKeyOrder() throws Exception {
        ObjectNode target = JsonMerge.deepMerge(JsonCodec.newObject(), obj("{\"b\":1,\"a\":2,\"c\":3}"));
        assertEquals("{\"b\":1,\"a\":2,\"c\":3}", JsonCodec.writeString(target));
    }
}
