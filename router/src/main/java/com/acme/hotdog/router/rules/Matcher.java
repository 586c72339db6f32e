package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

/**
 * Predicate over one field of a record.
 *
 * <p>Implementations are immutable and evaluated concurrently by every
 * connection worker. Evaluation never throws for bad record content.</p>
 */
public sealed interface Matcher permits QueryMatcher, PatternMatcher {

    String targetField();

    MatchResult evaluate(LogRecord record);

    /**
     * Human-readable form, used by rule test mode and log lines.
     */
    String describe();
}
