package com.acme.hotdog.router.rules;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled path into a JSON document.
 *
 * <p>Syntax: dot-separated keys ({@code meta.topic}), array indexes
 * ({@code items[0]}, {@code items[-1]} from the end) and double-quoted keys
 * for names containing dots or brackets ({@code "a.b".c}).</p>
 */
public final class QueryPath {
    private final String source;
    private final List<Segment> segments;

    private QueryPath(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
    }

    public static CompileResult compile(String source) {
        if (source == null || source.isBlank()) {
            return new CompileResult.Failure("EMPTY_PATH", "query path is blank", 0);
        }
        List<Segment> segments = new ArrayList<>();
        int i = 0;
        int n = source.length();
        boolean expectKey = true;
        while (i < n) {
            char c = source.charAt(i);
            if (c == '[') {
                int close = source.indexOf(']', i);
                if (close < 0) {
                    return new CompileResult.Failure("UNCLOSED_INDEX", "missing ']'", i);
                }
                String digits = source.substring(i + 1, close).trim();
                int index;
                try {
                    index = Integer.parseInt(digits);
                } catch (NumberFormatException e) {
                    return new CompileResult.Failure("BAD_INDEX", "array index is not an integer: '" + digits + "'", i);
                }
                // a leading index addresses a top-level array
                if (expectKey && i > 0) {
                    return new CompileResult.Failure("EMPTY_SEGMENT", "index follows an empty segment", i);
                }
                segments.add(new Index(index));
                i = close + 1;
                expectKey = false;
                continue;
            }
            if (c == '.') {
                if (expectKey) {
                    return new CompileResult.Failure("EMPTY_SEGMENT", "empty path segment", i);
                }
                expectKey = true;
                i++;
                if (i == n) {
                    return new CompileResult.Failure("TRAILING_DOT", "path ends with '.'", i - 1);
                }
                continue;
            }
            if (!expectKey) {
                return new CompileResult.Failure("UNEXPECTED_CHAR", "expected '.' or '[' but found '" + c + "'", i);
            }
            if (c == '"') {
                StringBuilder key = new StringBuilder();
                int j = i + 1;
                boolean closed = false;
                while (j < n) {
                    char q = source.charAt(j);
                    if (q == '\\' && j + 1 < n) {
                        key.append(source.charAt(j + 1));
                        j += 2;
                        continue;
                    }
                    if (q == '"') {
                        closed = true;
                        break;
                    }
                    key.append(q);
                    j++;
                }
                if (!closed) {
                    return new CompileResult.Failure("UNCLOSED_QUOTE", "missing closing '\"'", i);
                }
                segments.add(new Key(key.toString()));
                i = j + 1;
            } else {
                int start = i;
                while (i < n && source.charAt(i) != '.' && source.charAt(i) != '[') {
                    char k = source.charAt(i);
                    if (Character.isWhitespace(k) || k == '"' || k == ']') {
                        return new CompileResult.Failure("UNEXPECTED_CHAR", "unexpected '" + k + "' in key", i);
                    }
                    i++;
                }
                segments.add(new Key(source.substring(start, i)));
            }
            expectKey = false;
        }
        if (segments.isEmpty()) {
            return new CompileResult.Failure("EMPTY_PATH", "query path has no segments", 0);
        }
        return new CompileResult.Success(new QueryPath(source, segments));
    }

    /**
     * Node at this path, or null when any step is missing or of the wrong kind.
     */
    public JsonNode resolve(JsonNode root) {
        JsonNode current = root;
        for (Segment segment : segments) {
            if (current == null) {
                return null;
            }
            current = segment.step(current);
        }
        return current;
    }

    public String source() {
        return source;
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        return source;
    }

    private sealed interface Segment permits Key, Index {
        JsonNode step(JsonNode node);
    }

    private record Key(String name) implements Segment {
        @Override
        public JsonNode step(JsonNode node) {
            return node.isObject() ? node.get(name) : null;
        }
    }

    private record Index(int index) implements Segment {
        @Override
        public JsonNode step(JsonNode node) {
            if (!node.isArray()) {
                return null;
            }
            int i = index < 0 ? node.size() + index : index;
            return (i < 0 || i >= node.size()) ? null : node.get(i);
        }
    }
}
