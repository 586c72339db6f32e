package com.acme.hotdog.router.dispatch;

import com.acme.hotdog.router.telemetry.NoopRouterMetrics;
import com.acme.hotdog.router.telemetry.RouterMetrics;
import com.acme.hotdog.router.util.RouterDefaults;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, backpressured hand-off in front of a {@link DeliverySink}.
 *
 * <p>Submitters block while the buffer is full. A single delivery thread owns
 * the sink session; transient failures reconnect and retry the same envelope
 * with capped exponential backoff, so delivery order matches submission
 * order.</p>
 */
public final class Dispatcher implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Dispatcher.class.getName());
    private static final long POLL_MILLIS = 100L;

    private final EnvelopeBuffer buffer;
    private final DeliverySink sink;
    private final Backoff backoff;
    private final RouterMetrics metrics;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean abandon;
    private volatile Thread deliveryThread;

    public Dispatcher(int capacity, DeliverySink sink, Backoff backoff, RouterMetrics metrics) {
        this.buffer = new EnvelopeBuffer(capacity);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.metrics = metrics == null ? NoopRouterMetrics.INSTANCE : metrics;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::deliveryLoop, "hotdog-delivery");
        t.setDaemon(true);
        deliveryThread = t;
        t.start();
    }

    /**
     * Queues {@code envelope}, blocking while the buffer is full.
     */
    public SubmitResult submit(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        long seq;
        try {
            seq = buffer.put(envelope);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new SubmitResult.Rejected(RejectReason.INTERRUPTED);
        }
        if (seq == EnvelopeBuffer.CLOSED) {
            return new SubmitResult.Rejected(RejectReason.CLOSED);
        }
        int depth = buffer.size();
        metrics.setBufferDepth(depth);
        return new SubmitResult.Accepted(seq, depth);
    }

    public int depth() {
        return buffer.size();
    }

    public int capacity() {
        return buffer.capacity();
    }

    private void deliveryLoop() {
        while (true) {
            Envelope head;
            try {
                head = buffer.peek(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                break;
            }
            if (head == null) {
                if (buffer.isDrained() || abandon) {
                    break;
                }
                continue;
            }
            deliver(head);
            buffer.removeHead();
            metrics.setBufferDepth(buffer.size());
            if (abandon) {
                break;
            }
        }
    }

    private void deliver(Envelope envelope) {
        int attempt = 0;
        while (true) {
            try {
                sink.deliver(envelope);
                metrics.incDelivered();
                return;
            } catch (SinkException e) {
                if (!e.isTransient()) {
                    metrics.incDeliveryFailures();
                    LOG.log(Level.SEVERE, "delivery to topic " + envelope.topic() + " failed permanently", e);
                    return;
                }
                if (abandon) {
                    metrics.incDeliveryFailures();
                    LOG.log(Level.SEVERE, "delivery to topic " + envelope.topic() + " abandoned at shutdown", e);
                    return;
                }
                attempt++;
                metrics.incDeliveryRetries();
                long delay = backoff.delayMillis(attempt);
                final int failedAttempt = attempt;
                LOG.log(Level.WARNING, e, () -> "delivery attempt " + failedAttempt + " failed, retrying in " + delay + "ms");
                if (!pause(delay)) {
                    abandon = true;
                    continue;
                }
                reconnectQuietly();
            } catch (RuntimeException e) {
                metrics.incDeliveryFailures();
                LOG.log(Level.SEVERE, "delivery to topic " + envelope.topic() + " failed unexpectedly", e);
                return;
            }
        }
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }

    private void reconnectQuietly() {
        try {
            sink.reconnect();
        } catch (SinkException e) {
            LOG.log(Level.WARNING, "sink reconnect failed", e);
        }
    }

    /**
     * Rejects new and waiting submissions, then waits up to {@code timeout} for
     * buffered envelopes to be delivered before closing the sink. Envelopes still
     * buffered at the deadline are logged as lost.
     */
    public void stopAndDrain(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        buffer.close();
        Thread t = deliveryThread;
        if (t != null) {
            try {
                t.join(Math.max(1L, timeout.toMillis()));
                if (t.isAlive()) {
                    abandon = true;
                    t.interrupt();
                    t.join(Math.max(1L, timeout.toMillis()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int remaining = buffer.size();
        if (remaining > 0) {
            LOG.severe("dispatcher stopped with " + remaining + " undelivered envelopes");
        }
        metrics.setBufferDepth(remaining);
        sink.close();
    }

    @Override
    public void close() {
        stopAndDrain(Duration.ofMillis(RouterDefaults.DEFAULT_DRAIN_TIMEOUT_MS));
    }
}
