package com.acme.hotdog.router.dispatch;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers envelopes to Kafka, waiting for each acknowledgement.
 *
 * <p>Retriable broker errors and acknowledgement timeouts are transient; the
 * dispatcher then calls {@link #reconnect()}, which replaces the producer.</p>
 */
public final class KafkaDeliverySink implements DeliverySink {
    private static final Logger LOG = Logger.getLogger(KafkaDeliverySink.class.getName());
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Supplier<Producer<String, byte[]>> producerFactory;
    private final long deliveryTimeoutMillis;
    private Producer<String, byte[]> producer;

    public KafkaDeliverySink(Supplier<Producer<String, byte[]>> producerFactory, long deliveryTimeoutMillis) {
        this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
        this.deliveryTimeoutMillis = Math.max(1L, deliveryTimeoutMillis);
        this.producer = producerFactory.get();
    }

    public static KafkaDeliverySink fromConfig(Map<String, String> conf, long deliveryTimeoutMillis) {
        Map<String, String> copy = Map.copyOf(conf);
        return new KafkaDeliverySink(() -> createProducer(copy), deliveryTimeoutMillis);
    }

    static Producer<String, byte[]> createProducer(Map<String, String> conf) {
        Properties props = new Properties();
        props.putAll(conf);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        return new KafkaProducer<>(props);
    }

    @Override
    public void deliver(Envelope envelope) throws SinkException {
        if (producer == null) {
            producer = newProducer();
        }
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(envelope.topic(), envelope.key(), envelope.payload());
        try {
            producer.send(record).get(deliveryTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkException("interrupted while waiting for ack", e, true);
        } catch (TimeoutException e) {
            throw new SinkException("no ack within " + deliveryTimeoutMillis + "ms", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new SinkException("send to " + envelope.topic() + " failed: " + cause.getMessage(), cause,
                cause instanceof RetriableException);
        } catch (KafkaException e) {
            throw new SinkException("send to " + envelope.topic() + " failed: " + e.getMessage(), e,
                e instanceof RetriableException);
        }
    }

    @Override
    public void reconnect() throws SinkException {
        closeProducer();
        producer = newProducer();
        LOG.info("Kafka producer re-created");
    }

    private Producer<String, byte[]> newProducer() throws SinkException {
        try {
            return producerFactory.get();
        } catch (KafkaException e) {
            throw new SinkException("producer creation failed", e, true);
        }
    }

    @Override
    public void close() {
        closeProducer();
    }

    private void closeProducer() {
        Producer<String, byte[]> current = producer;
        if (current == null) {
            return;
        }
        producer = null;
        try {
            current.flush();
            current.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            LOG.log(Level.WARNING, "Kafka producer close failed", e);
        }
    }
}
