package com.acme.hotdog.router.rules;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A matcher and the actions applied, in order, when it matches.
 */
public record Rule(Matcher matcher, List<Action> actions) {
    public Rule {
        Objects.requireNonNull(matcher, "matcher");
        actions = List.copyOf(actions);
    }

    public String describe() {
        String types = actions.stream().map(Action::type).collect(Collectors.joining(", "));
        return matcher.describe() + " -> [" + types + "]";
    }
}
