package com.acme.hotdog.router.dispatch;

/**
 * Delivery failure. Transient failures are retried after a reconnect.
 */
public final class SinkException extends Exception {
    private final boolean transientFailure;

    public SinkException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
