package com.acme.hotdog.router.template;

import com.acme.hotdog.router.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON fragment whose string leaves are templates.
 *
 * <p>The fragment is compiled once; {@link #expand(Map)} builds a fresh
 * {@link ObjectNode} per call, so the result can be merged into a record
 * without aliasing the compiled tree. Object keys are taken literally.</p>
 */
public final class MergeTemplate {
    private final Node root;

    private MergeTemplate(Node root) {
        this.root = root;
    }

    /**
     * @throws IllegalArgumentException when {@code fragment} is not a JSON object
     * @throws TemplateException when a string leaf is not a valid template
     */
    public static MergeTemplate compile(JsonNode fragment, TemplateEngine engine) {
        Objects.requireNonNull(fragment, "fragment");
        if (!fragment.isObject()) {
            throw new IllegalArgumentException("merge fragment must be a JSON object, got " + fragment.getNodeType());
        }
        return new MergeTemplate(compileNode(fragment, engine));
    }

    private static Node compileNode(JsonNode node, TemplateEngine engine) {
        if (node.isObject()) {
            Map<String, Node> children = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                children.put(e.getKey(), compileNode(e.getValue(), engine));
            }
            return new ObjectTemplate(children);
        }
        if (node.isArray()) {
            List<Node> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(compileNode(item, engine));
            }
            return new ArrayTemplate(items);
        }
        if (node.isTextual()) {
            CompiledTemplate template = engine.compile(node.textValue());
            if (!template.isConstant()) {
                return new TextTemplate(template);
            }
        }
        return new Literal(node.deepCopy());
    }

    public ObjectNode expand(Map<String, ?> variables) throws IOException {
        return (ObjectNode) root.expand(variables);
    }

    private sealed interface Node permits ObjectTemplate, ArrayTemplate, TextTemplate, Literal {
        JsonNode expand(Map<String, ?> variables) throws IOException;
    }

    private record ObjectTemplate(Map<String, Node> children) implements Node {
        @Override
        public JsonNode expand(Map<String, ?> variables) throws IOException {
            ObjectNode out = JsonCodec.newObject();
            for (Map.Entry<String, Node> e : children.entrySet()) {
                out.set(e.getKey(), e.getValue().expand(variables));
            }
            return out;
        }
    }

    private record ArrayTemplate(List<Node> items) implements Node {
        @Override
        public JsonNode expand(Map<String, ?> variables) throws IOException {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(items.size());
            for (Node item : items) {
                out.add(item.expand(variables));
            }
            return out;
        }
    }

    private record TextTemplate(CompiledTemplate template) implements Node {
        @Override
        public JsonNode expand(Map<String, ?> variables) throws IOException {
            return JsonNodeFactory.instance.textNode(template.render(variables));
        }
    }

    private record Literal(JsonNode value) implements Node {
        @Override
        public JsonNode expand(Map<String, ?> variables) {
            return value.deepCopy();
        }
    }
}
