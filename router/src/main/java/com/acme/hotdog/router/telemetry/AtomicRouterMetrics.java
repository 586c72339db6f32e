package com.acme.hotdog.router.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicRouterMetrics implements RouterMetrics {
    private final LongAdder connections = new LongAdder();
    private final LongAdder lines = new LongAdder();
    private final LongAdder matched = new LongAdder();
    private final LongAdder unmatched = new LongAdder();
    private final LongAdder parseErrors = new LongAdder();
    private final LongAdder actionFailures = new LongAdder();
    private final LongAdder submitted = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder deliveryFailures = new LongAdder();
    private final LongAdder deliveryRetries = new LongAdder();
    private final AtomicInteger bufferDepth = new AtomicInteger();

    @Override
    public void incConnections() {
        connections.increment();
    }

    @Override
    public void incLines() {
        lines.increment();
    }

    @Override
    public void incMatched() {
        matched.increment();
    }

    @Override
    public void incUnmatched() {
        unmatched.increment();
    }

    @Override
    public void incParseErrors(long n) {
        if (n <= 0) return;
        parseErrors.add(n);
    }

    @Override
    public void incActionFailures(long n) {
        if (n <= 0) return;
        actionFailures.add(n);
    }

    @Override
    public void incSubmitted() {
        submitted.increment();
    }

    @Override
    public void incRejected() {
        rejected.increment();
    }

    @Override
    public void incDelivered() {
        delivered.increment();
    }

    @Override
    public void incDeliveryFailures() {
        deliveryFailures.increment();
    }

    @Override
    public void incDeliveryRetries() {
        deliveryRetries.increment();
    }

    @Override
    public void setBufferDepth(int depth) {
        bufferDepth.set(Math.max(0, depth));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            connections.sum(),
            lines.sum(),
            matched.sum(),
            unmatched.sum(),
            parseErrors.sum(),
            actionFailures.sum(),
            submitted.sum(),
            rejected.sum(),
            delivered.sum(),
            deliveryFailures.sum(),
            deliveryRetries.sum(),
            bufferDepth.get()
        );
    }

    public record Snapshot(long connections,
                           long lines,
                           long matched,
                           long unmatched,
                           long parseErrors,
                           long actionFailures,
                           long submitted,
                           long rejected,
                           long delivered,
                           long deliveryFailures,
                           long deliveryRetries,
                           int bufferDepth) {

        /**
         * Monotonic counters by short name, in a stable order.
         */
        public Map<String, Long> counters() {
            Map<String, Long> out = new LinkedHashMap<>();
            out.put("connections", connections);
            out.put("lines", lines);
            out.put("matched", matched);
            out.put("unmatched", unmatched);
            out.put("parse_errors", parseErrors);
            out.put("action_failures", actionFailures);
            out.put("submitted", submitted);
            out.put("rejected", rejected);
            out.put("delivered", delivered);
            out.put("delivery_failures", deliveryFailures);
            out.put("delivery_retries", deliveryRetries);
            return out;
        }
    }
}
