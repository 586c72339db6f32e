package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

/**
 * Template variables for the actions of one matched rule.
 *
 * <p>Built on first use: record fields, then the matcher's captures, then
 * {@code version} and {@code iso8601}. Later entries win on name clashes.</p>
 */
public final class ActionContext {
    public static final String VERSION = "version";
    public static final String ISO8601 = "iso8601";

    private final LogRecord record;
    private final Map<String, String> captures;
    private final RuntimeValues runtime;
    private Map<String, Object> variables;

    public ActionContext(LogRecord record, Map<String, String> captures, RuntimeValues runtime) {
        this.record = record;
        this.captures = captures;
        this.runtime = runtime;
    }

    public Map<String, Object> variables() {
        if (variables == null) {
            Map<String, Object> vars = new HashMap<>(record.fields().size() + captures.size() + 2);
            vars.putAll(record.fields());
            vars.putAll(captures);
            vars.put(VERSION, runtime.version());
            vars.put(ISO8601, DateTimeFormatter.ISO_INSTANT.format(
                runtime.clock().instant().truncatedTo(ChronoUnit.SECONDS)));
            variables = vars;
        }
        return variables;
    }
}
