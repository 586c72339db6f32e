package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.template.JsonMerge;
import com.acme.hotdog.router.template.MergeTemplate;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Objects;

/**
 * Deep-merges an expanded JSON fragment into the record's output document.
 * The document starts from the JSON object held by {@code seedField}, if any.
 */
public record MergeAction(String seedField, MergeTemplate template) implements Action {
    public static final String TYPE = "merge";

    public MergeAction {
        Objects.requireNonNull(template, "template");
    }

    @Override
    public void apply(LogRecord record, ActionContext context) throws IOException {
        // expand first so a render failure leaves the record untouched
        ObjectNode patch = template.expand(context.variables());
        JsonMerge.deepMerge(record.structuredForMerge(seedField), patch);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
