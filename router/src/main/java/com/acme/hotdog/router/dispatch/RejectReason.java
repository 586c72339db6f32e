package com.acme.hotdog.router.dispatch;

public enum RejectReason {
    /** Dispatcher is shutting down or closed. */
    CLOSED,
    /** The submitting thread was interrupted while waiting for room. */
    INTERRUPTED
}
