package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches when a path resolves to a non-null value in the JSON view of the
 * target field. The resolved value is captured as {@code value}.
 */
public final class QueryMatcher implements Matcher {
    public static final String VALUE_CAPTURE = "value";

    private final QueryPath path;
    private final String targetField;

    public QueryMatcher(QueryPath path, String targetField) {
        this.path = Objects.requireNonNull(path, "path");
        this.targetField = Objects.requireNonNull(targetField, "targetField");
    }

    @Override
    public String targetField() {
        return targetField;
    }

    public QueryPath path() {
        return path;
    }

    @Override
    public MatchResult evaluate(LogRecord record) {
        Optional<JsonNode> view = record.parsedField(targetField);
        if (view.isEmpty()) {
            return MatchResult.NO_MATCH;
        }
        JsonNode hit = path.resolve(view.get());
        if (hit == null || hit.isNull() || hit.isMissingNode()) {
            return MatchResult.NO_MATCH;
        }
        String captured = hit.isValueNode() ? hit.asText() : hit.toString();
        return MatchResult.matched(Map.of(VALUE_CAPTURE, captured));
    }

    @Override
    public String describe() {
        return "jmespath '" + path.source() + "' on " + targetField;
    }

    @Override
    public String toString() {
        return describe();
    }
}
