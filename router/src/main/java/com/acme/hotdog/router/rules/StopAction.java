package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

public record StopAction() implements Action {
    public static final String TYPE = "stop";
    public static final StopAction INSTANCE = new StopAction();

    @Override
    public void apply(LogRecord record, ActionContext context) {
        record.terminate();
    }

    @Override
    public String type() {
        return TYPE;
    }
}
