package com.acme.hotdog.router.rules;

import java.util.List;

/**
 * Result of running a record through a {@link RuleSet}.
 *
 * @param topic          resolved destination
 * @param matchedRules   indexes of the rules that matched, in evaluation order
 * @param terminated     whether a stop action ended evaluation
 * @param failedActions  actions skipped because their template failed to render
 */
public record Evaluation(String topic, List<Integer> matchedRules, boolean terminated, int failedActions) {
    public Evaluation {
        matchedRules = List.copyOf(matchedRules);
    }

    public boolean matched() {
        return !matchedRules.isEmpty();
    }
}
