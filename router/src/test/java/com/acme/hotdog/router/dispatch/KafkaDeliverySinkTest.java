package com.acme.hotdog.router.dispatch;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.NotEnoughReplicasException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class KafkaDeliverySinkTest {
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final List<MockProducer<String, byte[]>> created = new ArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Supplier<Producer<String, byte[]>> factory(boolean autoComplete) {
        return () -> {
            MockProducer<String, byte[]> producer =
                new MockProducer<>(autoComplete, new StringSerializer(), new ByteArraySerializer());
            created.add(producer);
            return producer;
        };
    }

    private static Envelope envelope(String topic, String text) {
        return new Envelope(topic, text.getBytes(StandardCharsets.UTF_8), null);
    }

    @Test
    void shouldSendToEnvelopeTopic() throws Exception {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(true), 1_000);

        sink.deliver(envelope("logs-auth", "{\"a\":1}"));

        List<ProducerRecord<String, byte[]>> history = created.get(0).history();
        assertEquals(1, history.size());
        assertEquals("logs-auth", history.get(0).topic());
        assertNull(history.get(0).key());
        assertArrayEquals("{\"a\":1}".getBytes(StandardCharsets.UTF_8), history.get(0).value());
    }

    @Test
    void shouldTreatRetriableBrokerErrorAsTransient() throws Exception {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(false), 5_000);
        MockProducer<String, byte[]> producer = created.get(0);

        Future<SinkException> outcome = executor.submit(() -> deliverExpectingFailure(sink));
        awaitHistory(producer, 1);
        assertTrue(producer.errorNext(new NotEnoughReplicasException("isr shrunk")));

        assertTrue(outcome.get(5, TimeUnit.SECONDS).isTransient());
    }

    @Test
    void shouldTreatOversizedRecordAsPermanent() throws Exception {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(false), 5_000);
        MockProducer<String, byte[]> producer = created.get(0);

        Future<SinkException> outcome = executor.submit(() -> deliverExpectingFailure(sink));
        awaitHistory(producer, 1);
        assertTrue(producer.errorNext(new RecordTooLargeException("too big")));

        assertFalse(outcome.get(5, TimeUnit.SECONDS).isTransient());
    }

    @Test
    void shouldTimeOutAsTransientWhenNoAckArrives() {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(false), 50);

        SinkException failure = deliverExpectingFailure(sink);

        assertTrue(failure.isTransient());
    }

    @Test
    void shouldReplaceProducerOnReconnect() throws Exception {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(true), 1_000);
        MockProducer<String, byte[]> first = created.get(0);

        sink.reconnect();
        sink.deliver(envelope("logs", "after"));

        assertEquals(2, created.size());
        assertTrue(first.closed());
        assertTrue(first.history().isEmpty());
        assertEquals(1, created.get(1).history().size());

        sink.close();
        assertTrue(created.get(1).closed());
    }

    @Test
    void shouldRecreateProducerAfterClose() throws Exception {
        KafkaDeliverySink sink = new KafkaDeliverySink(factory(true), 1_000);
        sink.close();

        sink.deliver(envelope("logs", "again"));

        assertEquals(2, created.size());
        assertEquals(1, created.get(1).history().size());
    }

    private static SinkException deliverExpectingFailure(KafkaDeliverySink sink) {
        try {
            sink.deliver(envelope("logs", "payload"));
        } catch (SinkException e) {
            return e;
        }
        return fail("delivery should have failed");
    }

    private static void awaitHistory(MockProducer<String, byte[]> producer, int size) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (producer.history().size() < size) {
            if (System.nanoTime() > deadline) {
                fail("producer never saw " + size + " records");
            }
            Thread.sleep(10);
        }
    }
}
