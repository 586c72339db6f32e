package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.record.LogRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Unanchored regular expression over the raw text of the target field.
 * Named groups that took part in the match are captured by name.
 */
public final class PatternMatcher implements com.acme.hotdog.router.rules.Matcher {
    private static final Logger LOG = Logger.getLogger(PatternMatcher.class.getName());
    private static final Pattern PYTHON_GROUP = Pattern.compile("\\(\\?P<");
    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");
    private static final Pattern EMPTY = Pattern.compile("");

    private final Pattern pattern;
    private final List<String> groupNames;
    private final String targetField;

    private PatternMatcher(Pattern pattern, List<String> groupNames, String targetField) {
        this.pattern = pattern;
        this.groupNames = List.copyOf(groupNames);
        this.targetField = targetField;
    }

    /**
     * Compiles {@code regex}. Python-style {@code (?P<name>...)} groups are accepted.
     *
     * @throws PatternSyntaxException when the expression is invalid
     */
    public static PatternMatcher compile(String regex, String targetField) {
        Objects.requireNonNull(regex, "regex");
        Objects.requireNonNull(targetField, "targetField");
        String normalized = PYTHON_GROUP.matcher(regex).replaceAll("(?<");
        Pattern pattern = Pattern.compile(normalized);
        return new PatternMatcher(pattern, declaredGroups(pattern, namedGroups(normalized)), targetField);
    }

    /**
     * Keeps the candidates {@code pattern} really declares; group syntax inside a
     * character class or a {@code \Q...\E} quote is not a group.
     */
    static List<String> declaredGroups(Pattern pattern, List<String> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        // group(name) needs a matcher in matched state; usePattern keeps that state
        Matcher lookup = EMPTY.matcher("");
        lookup.find();
        lookup.usePattern(pattern);
        List<String> declared = new ArrayList<>(candidates.size());
        for (String name : candidates) {
            try {
                lookup.group(name);
                declared.add(name);
            } catch (IllegalArgumentException notAGroup) {
                LOG.fine(() -> "regex '" + pattern.pattern() + "': <" + name + "> is not a capturing group");
            }
        }
        return declared;
    }

    static List<String> namedGroups(String regex) {
        List<String> names = new ArrayList<>();
        Matcher m = GROUP_NAME.matcher(regex);
        while (m.find()) {
            if (!isEscaped(regex, m.start())) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static boolean isEscaped(String s, int pos) {
        int backslashes = 0;
        for (int i = pos - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return (backslashes & 1) == 1;
    }

    @Override
    public String targetField() {
        return targetField;
    }

    public List<String> groupNames() {
        return groupNames;
    }

    @Override
    public MatchResult evaluate(LogRecord record) {
        String text = record.field(targetField);
        if (text == null) {
            return MatchResult.NO_MATCH;
        }
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return MatchResult.NO_MATCH;
        }
        if (groupNames.isEmpty()) {
            return MatchResult.matched(Map.of());
        }
        Map<String, String> captures = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value = m.group(name);
            if (value != null) {
                captures.put(name, value);
            }
        }
        return MatchResult.matched(captures);
    }

    @Override
    public String describe() {
        return "regex '" + pattern.pattern() + "' on " + targetField;
    }

    @Override
    public String toString() {
        return describe();
    }
}
