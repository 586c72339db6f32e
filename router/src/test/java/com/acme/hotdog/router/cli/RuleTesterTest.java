package com.acme.hotdog.router.cli;

import com.acme.hotdog.router.config.SettingsLoader;
import com.acme.hotdog.router.rules.RuleSet;
import com.acme.hotdog.router.rules.RuntimeValues;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RuleTesterTest {
    private static final String RULES = """
        global:
          kafka:
            topic: logs
        rules:
          - regex: 'error'
            field: msg
            actions:
              - type: stop
          - jmespath: 'meta.topic'
            field: msg
            actions:
              - type: forward
                topic: '{{value}}'
          - regex: '.*'
            field: hostname
            actions:
              - type: stop
        """;

    @TempDir
    Path dir;

    @Test
    void shouldListEveryMatchingRulePerLine() throws Exception {
        RuleSet ruleSet = new SettingsLoader(RuntimeValues.system()).parse(RULES).ruleSet();
        Path sample = dir.resolve("sample.log");
        Files.writeString(sample, String.join("\n",
            "nothing interesting",
            "<11>1 - web01 api - - - disk error",
            "{\"meta\":{\"topic\":\"audit\"},\"note\":\"error\"}"), StandardCharsets.UTF_8);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int matched = new RuleTester(ruleSet, new PrintStream(buffer, true, StandardCharsets.UTF_8)).run(sample);

        assertEquals(2, matched);
        String expected = "Line 2 matches on:\n"
            + "\t - rules[0] regex 'error' on msg\n"
            + "\t - rules[2] regex '.*' on hostname\n"
            + "Line 3 matches on:\n"
            + "\t - rules[0] regex 'error' on msg\n"
            + "\t - rules[1] jmespath 'meta.topic' on msg\n";
        assertEquals(expected, buffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n"));
    }
}
