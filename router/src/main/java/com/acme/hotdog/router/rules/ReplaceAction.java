package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.template.CompiledTemplate;

import java.io.IOException;
import java.util.Objects;

/**
 * Replaces the outgoing payload with rendered text.
 */
public record ReplaceAction(CompiledTemplate template) implements Action {
    public static final String TYPE = "replace";

    public ReplaceAction {
        Objects.requireNonNull(template, "template");
    }

    @Override
    public void apply(LogRecord record, ActionContext context) throws IOException {
        record.replacement(template.render(context.variables()));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
