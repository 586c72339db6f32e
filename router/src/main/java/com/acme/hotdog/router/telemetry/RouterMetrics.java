package com.acme.hotdog.router.telemetry;

public interface RouterMetrics {
    void incConnections();
    void incLines();
    void incMatched();
    void incUnmatched();
    void incParseErrors(long n);
    void incActionFailures(long n);
    void incSubmitted();
    void incRejected();
    void incDelivered();
    void incDeliveryFailures();
    void incDeliveryRetries();
    void setBufferDepth(int depth);
}
