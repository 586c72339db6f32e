package com.acme.hotdog.router.cli;

import com.acme.hotdog.router.record.LogRecord;
import com.acme.hotdog.router.record.SyslogParser;
import com.acme.hotdog.router.rules.RuleSet;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Offline check of which rules match each line of a file. Actions are not run.
 */
final class RuleTester {
    private final RuleSet ruleSet;
    private final SyslogParser parser;
    private final PrintStream out;

    RuleTester(RuleSet ruleSet, PrintStream out) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
        this.parser = new SyslogParser();
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * @return number of lines that matched at least one rule
     */
    int run(Path file) throws IOException {
        int matchedLines = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int number = 0;
            while ((line = reader.readLine()) != null) {
                number++;
                if (report(number, line)) {
                    matchedLines++;
                }
            }
        }
        return matchedLines;
    }

    boolean report(int number, String line) {
        LogRecord record = parser.parse(line);
        List<Integer> matches = ruleSet.matchingRules(record);
        if (matches.isEmpty()) {
            return false;
        }
        out.println("Line " + number + " matches on:");
        for (int index : matches) {
            out.println("\t - rules[" + index + "] " + ruleSet.rules().get(index).matcher().describe());
        }
        return true;
    }
}
