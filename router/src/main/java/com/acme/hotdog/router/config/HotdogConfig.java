package com.acme.hotdog.router.config;

import com.acme.hotdog.router.rules.RuleSet;

import java.util.Objects;

/**
 * A fully validated configuration: runtime settings plus the compiled rules.
 */
public record HotdogConfig(RouterSettings settings, RuleSet ruleSet) {
    public HotdogConfig {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(ruleSet, "ruleSet");
    }
}
