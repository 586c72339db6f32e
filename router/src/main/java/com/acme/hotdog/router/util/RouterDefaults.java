package com.acme.hotdog.router.util;

/**
 * Default capacity, timeout, and tuning constants for the router runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class RouterDefaults {

    // ---- Configuration ----
    public static final String DEFAULT_CONFIG_FILE = "hotdog.yml";

    // ---- Listener ----
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int DEFAULT_MAX_LINE_BYTES = 64 * 1024;
    public static final int DEFAULT_LISTENER_WORKERS = 16;

    // ---- Dispatcher ----
    public static final int DEFAULT_BUFFER = 1024;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_DELIVERY_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_BACKOFF_MIN_MS = 100L;
    public static final long DEFAULT_BACKOFF_MAX_MS = 5_000L;

    // ---- Metrics ----
    public static final String METRICS_PREFIX = "hotdog";
    public static final int DEFAULT_METRICS_INTERVAL_SEC = 10;
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private RouterDefaults() {
    }
}
