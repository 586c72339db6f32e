package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

import java.io.IOException;

/**
 * Effect of a matched rule on a record. Immutable after load.
 */
public sealed interface Action permits MergeAction, StopAction, ForwardAction, ReplaceAction {

    /**
     * @throws IOException when a template fails to render; the record is left as it was
     */
    void apply(LogRecord record, ActionContext context) throws IOException;

    String type();
}
