package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered rules plus the default topic. Immutable; shared by all workers.
 */
public final class RuleSet {
    private static final Logger LOG = Logger.getLogger(RuleSet.class.getName());

    private final List<Rule> rules;
    private final String defaultTopic;
    private final RuntimeValues runtime;

    public RuleSet(List<Rule> rules, String defaultTopic, RuntimeValues runtime) {
        this.rules = List.copyOf(rules);
        this.defaultTopic = Objects.requireNonNull(defaultTopic, "defaultTopic");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public List<Rule> rules() {
        return rules;
    }

    public String defaultTopic() {
        return defaultTopic;
    }

    /**
     * Runs the rules against {@code record}, mutating it. Evaluation ends at the
     * first stop action. The topic is the one set by the last forward action,
     * else the default topic.
     */
    public Evaluation evaluate(LogRecord record) {
        List<Integer> matched = new ArrayList<>(2);
        int failed = 0;
        for (int i = 0; i < rules.size(); i++) {
            if (record.terminated()) {
                break;
            }
            Rule rule = rules.get(i);
            MatchResult result = match(i, rule, record);
            if (!result.matched()) {
                continue;
            }
            matched.add(i);
            ActionContext context = new ActionContext(record, result.captures(), runtime);
            for (Action action : rule.actions()) {
                try {
                    action.apply(record, context);
                } catch (IOException | RuntimeException e) {
                    failed++;
                    final int ruleIndex = i;
                    LOG.log(Level.WARNING, e, () -> "rules[" + ruleIndex + "]: " + action.type() + " action skipped");
                }
                if (record.terminated()) {
                    break;
                }
            }
        }
        String topic = record.destinationTopic().orElse(defaultTopic);
        return new Evaluation(topic, matched, record.terminated(), failed);
    }

    /**
     * Indexes of every rule whose matcher accepts {@code record}, ignoring
     * actions and stop. The record's parse cache is the only state touched.
     */
    public List<Integer> matchingRules(LogRecord record) {
        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            if (match(i, rules.get(i), record).matched()) {
                matched.add(i);
            }
        }
        return matched;
    }

    /**
     * A matcher that throws is a no-match for this record only.
     */
    private static MatchResult match(int index, Rule rule, LogRecord record) {
        try {
            return rule.matcher().evaluate(record);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "rules[" + index + "]: " + rule.matcher().describe() + " failed, treated as no match");
            return MatchResult.NO_MATCH;
        }
    }
}
