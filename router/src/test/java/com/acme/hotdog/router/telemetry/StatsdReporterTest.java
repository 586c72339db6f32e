package com.acme.hotdog.router.telemetry;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatsdReporterTest {

    @Test
    void shouldEmitOnlyCounterDeltasSinceLastFlush() {
        AtomicRouterMetrics metrics = new AtomicRouterMetrics();
        Map<String, Long> previous = new HashMap<>();
        metrics.incLines();
        metrics.incLines();
        metrics.incSubmitted();
        metrics.setBufferDepth(4);

        String first = StatsdReporter.render(metrics.snapshot(), previous);

        assertEquals("hotdog.lines:2|c\nhotdog.submitted:1|c\nhotdog.buffer_depth:4|g\n", first);

        metrics.incLines();
        metrics.setBufferDepth(0);
        String second = StatsdReporter.render(metrics.snapshot(), previous);

        assertTrue(second.contains("hotdog.lines:1|c\n"));
        assertFalse(second.contains("hotdog.submitted"));
        assertTrue(second.endsWith("hotdog.buffer_depth:0|g\n"));
        assertEquals(3L, previous.get("lines"));
    }

    @Test
    void shouldEmitGaugeWhenNothingMoved() {
        String body = StatsdReporter.render(new AtomicRouterMetrics().snapshot(), new HashMap<>());

        assertEquals("hotdog.buffer_depth:0|g\n", body);
    }
}
