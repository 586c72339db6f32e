package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.template.CompiledTemplate;

import java.io.IOException;
import java.util.Objects;

/**
 * Sets the destination topic. When several forward actions run, the last wins.
 */
public record ForwardAction(CompiledTemplate topic) implements Action {
    public static final String TYPE = "forward";

    public ForwardAction {
        Objects.requireNonNull(topic, "topic");
    }

    @Override
    public void apply(LogRecord record, ActionContext context) throws IOException {
        String rendered = topic.render(context.variables());
        if (rendered.isBlank()) {
            throw new IOException("topic template '" + topic.source() + "' rendered empty");
        }
        record.destinationTopic(rendered);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
