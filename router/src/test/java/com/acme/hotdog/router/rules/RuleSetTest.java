package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.config.SettingsLoader;
import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.record.SyslogParser;
import com.acme.hotdog.router.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleSetTest {
    private static final RuntimeValues RUNTIME = new RuntimeValues(
        "1.2.3", Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));

    private static final String SCENARIO_RULES = """
        global:
          kafka:
            topic: logs-default
        rules:
          - jmespath: 'meta.topic'
            field: msg
            actions:
              - type: merge
                json:
                  meta:
                    hotdog:
                      version: '{{version}}'
                      timestamp: '{{iso8601}}'
              - type: stop
          - regex: '.*'
            field: msg
            actions:
              - type: stop
        """;

    static RuleSet rules(String yaml) {
        return new SettingsLoader(RUNTIME).parse(yaml).ruleSet();
    }

    private static String payload(LogRecord record) {
        return new String(record.payload(), StandardCharsets.UTF_8);
    }

    @Test
    void shouldEnrichStructuredRecordAndStop() throws Exception {
        LogRecord record = LogRecord.ofMessage("{\"meta\":{\"topic\":\"foo\"}}");

        Evaluation evaluation = rules(SCENARIO_RULES).evaluate(record);

        assertEquals("logs-default", evaluation.topic());
        assertEquals(List.of(0), evaluation.matchedRules());
        assertTrue(evaluation.terminated());
        assertEquals(
            JsonCodec.readTree("{\"meta\":{\"topic\":\"foo\",\"hotdog\":{\"version\":\"1.2.3\",\"timestamp\":\"2024-01-01T00:00:00Z\"}}}"),
            record.structured().orElseThrow());
    }

    @Test
    void shouldFallThroughToCatchAllForUnparseableRecord() {
        LogRecord record = LogRecord.ofMessage("plain text, no json");

        Evaluation evaluation = rules(SCENARIO_RULES).evaluate(record);

        assertEquals("logs-default", evaluation.topic());
        assertEquals(List.of(1), evaluation.matchedRules());
        assertTrue(evaluation.terminated());
        assertTrue(record.structured().isEmpty());
        assertArrayEquals("plain text, no json".getBytes(StandardCharsets.UTF_8), record.payload());
    }

    @Test
    void shouldRouteUnmatchedRecordToDefaultTopicUnmutated() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: fallback
            rules:
              - regex: 'never-present'
                field: msg
                actions:
                  - type: forward
                    topic: elsewhere
            """);
        LogRecord record = LogRecord.ofMessage("hello");

        Evaluation evaluation = ruleSet.evaluate(record);

        assertEquals("fallback", evaluation.topic());
        assertFalse(evaluation.matched());
        assertFalse(evaluation.terminated());
        assertEquals("hello", payload(record));
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInput() {
        RuleSet ruleSet = rules(SCENARIO_RULES);
        LogRecord first = LogRecord.ofMessage("{\"meta\":{\"topic\":\"foo\",\"z\":1,\"a\":2}}");
        LogRecord second = first.copy();

        Evaluation a = ruleSet.evaluate(first);
        Evaluation b = ruleSet.evaluate(second);

        assertEquals(a, b);
        assertArrayEquals(first.payload(), second.payload());
    }

    @Test
    void shouldKeepEvaluatingAfterMergeWithoutStop() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: t
            rules:
              - regex: 'a'
                field: msg
                actions:
                  - type: merge
                    json: {x: 1, nested: {keep: true}}
              - regex: 'b'
                field: msg
                actions:
                  - type: merge
                    json: {y: '{{msg}}', nested: {added: 'yes'}}
            """);
        LogRecord record = LogRecord.ofMessage("ab");

        Evaluation evaluation = ruleSet.evaluate(record);

        assertEquals(List.of(0, 1), evaluation.matchedRules());
        assertFalse(evaluation.terminated());
        assertEquals("t", evaluation.topic());
        assertEquals("{\"x\":1,\"nested\":{\"keep\":true,\"added\":\"yes\"},\"y\":\"ab\"}", payload(record));
    }

    @Test
    void shouldSkipRemainingActionsAndRulesAfterStop() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: t
            rules:
              - regex: '.*'
                field: msg
                actions:
                  - type: stop
                  - type: forward
                    topic: not-this
              - regex: '.*'
                field: msg
                actions:
                  - type: forward
                    topic: nor-this
            """);

        Evaluation evaluation = ruleSet.evaluate(LogRecord.ofMessage("x"));

        assertEquals("t", evaluation.topic());
        assertEquals(List.of(0), evaluation.matchedRules());
    }

    @Test
    void lastForwardShouldWinAndSeeCaptures() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: t
            rules:
              - regex: 'app=(?P<app>\\w+)'
                field: msg
                actions:
                  - type: forward
                    topic: 'logs-{{app}}'
              - jmespath: 'level'
                field: msg
                actions:
                  - type: forward
                    topic: 'level-{{value}}'
            """);

        assertEquals("logs-billing", ruleSet.evaluate(LogRecord.ofMessage("app=billing started")).topic());
        assertEquals("level-warn",
            ruleSet.evaluate(LogRecord.ofMessage("{\"level\":\"warn\",\"app\":\"app=x\"}")).topic());
    }

    @Test
    void replaceShouldOverrideStructuredPayload() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: t
            rules:
              - regex: '.*'
                field: msg
                actions:
                  - type: merge
                    json: {ignored: true}
                  - type: replace
                    template: '{{hostname}}/{{appname}}: {{msg}}'
            """);
        LogRecord record = new SyslogParser().parse("<13>Oct 11 22:14:15 myhost sshd[42]: Accepted password");

        ruleSet.evaluate(record);

        assertEquals("myhost/sshd: Accepted password", payload(record));
    }

    @Test
    void shouldSkipActionWhoseTemplateRendersNothing() {
        RuleSet ruleSet = rules("""
            global:
              kafka:
                topic: t
            rules:
              - regex: '.*'
                field: msg
                actions:
                  - type: forward
                    topic: '{{missing}}'
                  - type: merge
                    json: {after: 'still applied'}
            """);
        LogRecord record = LogRecord.ofMessage("x");

        Evaluation evaluation = ruleSet.evaluate(record);

        assertEquals("t", evaluation.topic());
        assertEquals(1, evaluation.failedActions());
        assertEquals("{\"after\":\"still applied\"}", payload(record));
    }

    @Test
    void matchingRulesShouldListEveryMatchWithoutRunningActions() {
        RuleSet ruleSet = rules(SCENARIO_RULES);
        LogRecord record = LogRecord.ofMessage("{\"meta\":{\"topic\":\"foo\"}}");

        assertEquals(List.of(0, 1), ruleSet.matchingRules(record));
        assertFalse(record.terminated());
        assertTrue(record.structured().isEmpty());
    }
}
