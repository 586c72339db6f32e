package com.acme.hotdog.router.rules;

import java.util.Map;

/**
 * Outcome of one matcher against one record. Captures are empty on no-match.
 */
public record MatchResult(boolean matched, Map<String, String> captures) {
    public static final MatchResult NO_MATCH = new MatchResult(false, Map.of());

    public MatchResult {
        captures = captures == null ? Map.of() : Map.copyOf(captures);
    }

    public static MatchResult matched(Map<String, String> captures) {
        return new MatchResult(true, captures);
    }
}
