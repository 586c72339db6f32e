package com.acme.hotdog.router.dispatch;

/**
 * Destination of dispatched envelopes. Only the dispatcher's delivery thread
 * calls these methods.
 */
public interface DeliverySink extends AutoCloseable {

    /**
     * Returns once the destination acknowledged the envelope.
     */
    void deliver(Envelope envelope) throws SinkException;

    /**
     * Drops and re-establishes the session after a transient failure.
     */
    void reconnect() throws SinkException;

    @Override
    void close();
}
