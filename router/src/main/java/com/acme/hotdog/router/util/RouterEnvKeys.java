package com.acme.hotdog.router.util;

/**
 * Canonical environment variable names read by the router at startup.
 */
public final class RouterEnvKeys {
    public static final String HOTDOG_LISTENER_WORKERS = "HOTDOG_LISTENER_WORKERS";
    public static final String HOTDOG_MAX_LINE_BYTES = "HOTDOG_MAX_LINE_BYTES";

    public static final String HOTDOG_DRAIN_TIMEOUT_MS = "HOTDOG_DRAIN_TIMEOUT_MS";
    public static final String HOTDOG_DELIVERY_TIMEOUT_MS = "HOTDOG_DELIVERY_TIMEOUT_MS";
    public static final String HOTDOG_BACKOFF_MIN_MS = "HOTDOG_BACKOFF_MIN_MS";
    public static final String HOTDOG_BACKOFF_MAX_MS = "HOTDOG_BACKOFF_MAX_MS";

    public static final String HOTDOG_METRICS_INTERVAL_SEC = "HOTDOG_METRICS_INTERVAL_SEC";

    private RouterEnvKeys() {
    }
}
