package com.acme.hotdog.router.telemetry;

public final class NoopRouterMetrics implements RouterMetrics {
    public static final NoopRouterMetrics INSTANCE = new NoopRouterMetrics();

    private NoopRouterMetrics() {
    }

    @Override
    public void incConnections() {
    }

    @Override
    public void incLines() {
    }

    @Override
    public void incMatched() {
    }

    @Override
    public void incUnmatched() {
    }

    @Override
    public void incParseErrors(long n) {
    }

    @Override
    public void incActionFailures(long n) {
    }

    @Override
    public void incSubmitted() {
    }

    @Override
    public void incRejected() {
    }

    @Override
    public void incDelivered() {
    }

    @Override
    public void incDeliveryFailures() {
    }

    @Override
    public void incDeliveryRetries() {
    }

    @Override
    public void setBufferDepth(int depth) {
    }
}
