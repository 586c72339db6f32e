package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.config.ConfigurationException;
import com.acme.hotdog.router.config.HotdogSettings.ActionDefinition;
import com.acme.hotdog.router.config.HotdogSettings.RuleDefinition;
import com.acme.hotdog.router.record.RecordFields;
import com.acme.hotdog.router.template.MergeTemplate;
import com.acme.hotdog.router.template.TemplateEngine;
import com.acme.hotdog.router.template.TemplateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Turns {@code rules[]} definitions into a {@link RuleSet}. Every problem is
 * reported as a {@link ConfigurationException} naming the offending entry.
 */
public final class RuleSetCompiler {
    private static final Logger LOG = Logger.getLogger(RuleSetCompiler.class.getName());

    private final TemplateEngine templates;
    private final RuntimeValues runtime;

    public RuleSetCompiler(TemplateEngine templates, RuntimeValues runtime) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public RuleSet compile(List<RuleDefinition> definitions, String defaultTopic) {
        if (defaultTopic == null || defaultTopic.isBlank()) {
            throw new ConfigurationException("global.kafka.topic is required");
        }
        List<Rule> rules = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            rules.add(compileRule("rules[" + i + "]", definitions.get(i)));
        }
        LOG.fine(() -> "compiled " + rules.size() + " rules, default topic " + defaultTopic);
        return new RuleSet(rules, defaultTopic, runtime);
    }

    private Rule compileRule(String where, RuleDefinition def) {
        if (def == null) {
            throw new ConfigurationException(where + ": empty rule");
        }
        String field = def.field();
        if (field == null || field.isBlank()) {
            throw new ConfigurationException(where + ": field is required");
        }
        if (!RecordFields.isKnown(field)) {
            throw new ConfigurationException(where + ": unknown field '" + field + "', expected one of "
                + RecordFields.KNOWN.stream().sorted().toList());
        }
        Matcher matcher = compileMatcher(where, def, field);
        if (def.actions().isEmpty()) {
            throw new ConfigurationException(where + ": at least one action is required");
        }
        List<Action> actions = new ArrayList<>(def.actions().size());
        for (int a = 0; a < def.actions().size(); a++) {
            actions.add(compileAction(where + ".actions[" + a + "]", def.actions().get(a), field));
        }
        return new Rule(matcher, actions);
    }

    private static Matcher compileMatcher(String where, RuleDefinition def, String field) {
        boolean hasQuery = def.jmespath() != null;
        boolean hasRegex = def.regex() != null;
        if (hasQuery == hasRegex) {
            throw new ConfigurationException(where + ": exactly one of jmespath or regex is required");
        }
        if (hasQuery) {
            CompileResult result = QueryPath.compile(def.jmespath());
            if (result instanceof CompileResult.Failure failure) {
                throw new ConfigurationException(where + ": invalid jmespath '" + def.jmespath() + "' ("
                    + failure.code() + " at " + failure.position() + "): " + failure.message());
            }
            return new QueryMatcher(((CompileResult.Success) result).path(), field);
        }
        try {
            return PatternMatcher.compile(def.regex(), field);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(where + ": invalid regex: " + e.getDescription(), e);
        }
    }

    private Action compileAction(String where, ActionDefinition def, String field) {
        if (def == null || def.type() == null || def.type().isBlank()) {
            throw new ConfigurationException(where + ": type is required");
        }
        String type = def.type().trim().toLowerCase(Locale.ROOT);
        try {
            switch (type) {
                case MergeAction.TYPE -> {
                    if (def.json() == null || def.json().isNull()) {
                        throw new ConfigurationException(where + ": merge requires json");
                    }
                    if (!def.json().isObject()) {
                        throw new ConfigurationException(where + ": merge json must be an object");
                    }
                    return new MergeAction(field, MergeTemplate.compile(def.json(), templates));
                }
                case StopAction.TYPE -> {
                    return StopAction.INSTANCE;
                }
                case ForwardAction.TYPE -> {
                    if (def.topic() == null || def.topic().isBlank()) {
                        throw new ConfigurationException(where + ": forward requires topic");
                    }
                    return new ForwardAction(templates.compile(def.topic()));
                }
                case ReplaceAction.TYPE -> {
                    if (def.template() == null) {
                        throw new ConfigurationException(where + ": replace requires template");
                    }
                    return new ReplaceAction(templates.compile(def.template()));
                }
                default -> throw new ConfigurationException(where + ": unknown action type '" + def.type() + "'");
            }
        } catch (TemplateException e) {
            throw new ConfigurationException(where + ": " + e.getMessage(), e);
        }
    }
}
