package com.acme.hotdog.router.dispatch;

import com.acme.hotdog.router.record.LogRecord;

import java.util.Objects;

/**
 * One outgoing message. {@code key} may be null for default partitioning.
 */
public record Envelope(String topic, byte[] payload, String key) {
    public Envelope {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
    }

    public static Envelope of(LogRecord record, String topic) {
        return new Envelope(topic, record.payload(), null);
    }
}
