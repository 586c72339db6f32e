package com.acme.hotdog.router.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Structural deep merge of JSON objects.
 *
 * <p>Objects unify key by key, recursively. Scalars and arrays in the patch
 * replace what the target holds; arrays are never concatenated. Patch keys are
 * visited in document order. Merging the same patch twice leaves the target as
 * it was after the first merge.</p>
 */
public final class JsonMerge {
    private JsonMerge() {
    }

    public static ObjectNode deepMerge(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> it = patch.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode incoming = entry.getValue();
            JsonNode existing = target.get(key);
            if (incoming.isObject() && existing != null && existing.isObject()) {
                deepMerge((ObjectNode) existing, (ObjectNode) incoming);
            } else {
                target.set(key, incoming.deepCopy());
            }
        }
        return target;
    }
}
