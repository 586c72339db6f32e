package com.acme.hotdog.router.transport;

import com.acme.hotdog.router.dispatch.Dispatcher;
import com.acme.hotdog.router.dispatch.Envelope;
import com.acme.hotdog.router.dispatch.SubmitResult;
import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.record.SyslogParser;
import com.acme.hotdog.router.rules.Evaluation;
import com.acme.hotdog.router.rules.RuleSet;
import com.acme.hotdog.router.telemetry.NoopRouterMetrics;
import com.acme.hotdog.router.telemetry.RouterMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main processing orchestrator:
 * inbound line -> record -> rule evaluation -> envelope -> dispatcher.
 *
 * <p>Called from connection workers; blocks while the dispatcher is full.</p>
 */
public final class RoutingPipeline {
    private static final Logger LOG = Logger.getLogger(RoutingPipeline.class.getName());

    private final SyslogParser parser;
    private final RuleSet ruleSet;
    private final Dispatcher dispatcher;
    private final RouterMetrics metrics;

    public RoutingPipeline(RuleSet ruleSet, Dispatcher dispatcher) {
        this(new SyslogParser(), ruleSet, dispatcher, NoopRouterMetrics.INSTANCE);
    }

    public RoutingPipeline(SyslogParser parser, RuleSet ruleSet, Dispatcher dispatcher, RouterMetrics metrics) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = metrics == null ? NoopRouterMetrics.INSTANCE : metrics;
    }

    public SubmitResult route(String line) {
        metrics.incLines();
        LogRecord record = parser.parse(line);
        Evaluation evaluation = ruleSet.evaluate(record);

        if (evaluation.matched()) {
            metrics.incMatched();
        } else {
            metrics.incUnmatched();
        }
        metrics.incParseErrors(record.parseFailures());
        metrics.incActionFailures(evaluation.failedActions());

        Envelope envelope;
        try {
            envelope = Envelope.of(record, evaluation.topic());
        } catch (RuntimeException e) {
            // structured document could not be serialized; fall back to the input bytes
            LOG.log(Level.WARNING, "payload serialization failed, forwarding raw line", e);
            metrics.incActionFailures(1L);
            envelope = new Envelope(evaluation.topic(), record.raw(), null);
        }

        SubmitResult result = dispatcher.submit(envelope);
        if (result instanceof SubmitResult.Rejected rejected) {
            metrics.incRejected();
            LOG.warning(() -> "record for topic " + evaluation.topic() + " rejected: " + rejected.reason());
        } else {
            metrics.incSubmitted();
        }
        return result;
    }
}
