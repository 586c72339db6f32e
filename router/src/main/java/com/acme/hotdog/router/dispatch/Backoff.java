package com.acme.hotdog.router.dispatch;

/**
 * Capped exponential backoff: {@code min * 2^(attempt-1)}, never above {@code max}.
 */
public record Backoff(long minMillis, long maxMillis) {
    public Backoff {
        if (minMillis < 1) {
            throw new IllegalArgumentException("minMillis must be >= 1");
        }
        if (maxMillis < minMillis) {
            throw new IllegalArgumentException("maxMillis must be >= minMillis");
        }
    }

    public long delayMillis(int attempt) {
        if (attempt <= 1) {
            return minMillis;
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = minMillis << shift;
        if (delay <= 0 || delay > maxMillis) {
            return maxMillis;
        }
        return delay;
    }
}
