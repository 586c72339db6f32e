package com.acme.hotdog.router.record;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a syslog line into {@link LogRecord} fields.
 *
 * <p>RFC 5424 headers are parsed completely. BSD style ({@code <PRI>Mmm dd hh:mm:ss host tag: msg})
 * lines get priority, timestamp, host and tag. Anything else becomes a record whose
 * {@code msg} is the whole line. Parsing never fails.</p>
 */
public final class SyslogParser {
    private static final String NIL = "-";
    private static final char BOM = '\uFEFF';
    private static final int BSD_TIMESTAMP_LENGTH = 15;
    private static final String[] SEVERITIES = {
        "emerg", "alert", "crit", "err", "warning", "notice", "info", "debug"
    };
    private static final String[] FACILITIES = {
        "kern", "user", "mail", "daemon", "auth", "syslog", "lpr", "news",
        "uucp", "cron", "authpriv", "ftp", "ntp", "security", "console", "solaris-cron",
        "local0", "local1", "local2", "local3", "local4", "local5", "local6", "local7"
    };

    public LogRecord parse(String line) {
        byte[] raw = line.getBytes(StandardCharsets.UTF_8);
        Map<String, String> fields = new LinkedHashMap<>();

        int pos = parsePriority(line, fields);
        if (pos < 0) {
            fields.put(RecordFields.MSG, line);
            return new LogRecord(raw, fields);
        }
        if (isRfc5424Version(line, pos)) {
            parseRfc5424(line, pos, fields);
        } else {
            parseBsd(line, pos, fields);
        }
        return new LogRecord(raw, fields);
    }

    private static int parsePriority(String line, Map<String, String> fields) {
        if (line.isEmpty() || line.charAt(0) != '<') {
            return -1;
        }
        int close = line.indexOf('>', 1);
        if (close < 2 || close > 4) {
            return -1;
        }
        int pri;
        try {
            pri = Integer.parseInt(line.substring(1, close));
        } catch (NumberFormatException notPriority) {
            return -1;
        }
        if (pri < 0 || pri > 191) {
            return -1;
        }
        fields.put(RecordFields.FACILITY, FACILITIES[pri >> 3]);
        fields.put(RecordFields.SEVERITY, SEVERITIES[pri & 0x7]);
        return close + 1;
    }

    private static boolean isRfc5424Version(String line, int pos) {
        int end = pos;
        if (end >= line.length() || line.charAt(end) == '0') {
            return false;
        }
        while (end < line.length() && Character.isDigit(line.charAt(end))) {
            end++;
        }
        return end > pos && end - pos <= 2 && end < line.length() && line.charAt(end) == ' ';
    }

    private static void parseRfc5424(String line, int pos, Map<String, String> fields) {
        Cursor c = new Cursor(line, pos);
        c.token(); // version
        putUnlessNil(fields, RecordFields.TIMESTAMP, c.token());
        putUnlessNil(fields, RecordFields.HOSTNAME, c.token());
        putUnlessNil(fields, RecordFields.APPNAME, c.token());
        putUnlessNil(fields, RecordFields.PROCID, c.token());
        putUnlessNil(fields, RecordFields.MSGID, c.token());
        c.skipStructuredData();
        String msg = c.rest();
        if (!msg.isEmpty() && msg.charAt(0) == BOM) {
            msg = msg.substring(1);
        }
        fields.put(RecordFields.MSG, msg);
    }

    private static void parseBsd(String line, int pos, Map<String, String> fields) {
        String rest = line.substring(pos);
        if (rest.length() > BSD_TIMESTAMP_LENGTH && looksLikeBsdTimestamp(rest)) {
            fields.put(RecordFields.TIMESTAMP, rest.substring(0, BSD_TIMESTAMP_LENGTH));
            Cursor c = new Cursor(rest, BSD_TIMESTAMP_LENGTH);
            String host = c.token();
            if (!host.isEmpty()) {
                fields.put(RecordFields.HOSTNAME, host);
            }
            rest = c.rest();
        }
        int colon = rest.indexOf(": ");
        if (colon > 0 && rest.lastIndexOf(' ', colon) < 0) {
            String tag = rest.substring(0, colon);
            int bracket = tag.indexOf('[');
            if (bracket > 0 && tag.endsWith("]")) {
                fields.put(RecordFields.APPNAME, tag.substring(0, bracket));
                fields.put(RecordFields.PROCID, tag.substring(bracket + 1, tag.length() - 1));
            } else {
                fields.put(RecordFields.APPNAME, tag);
            }
            rest = rest.substring(colon + 2);
        }
        fields.put(RecordFields.MSG, rest);
    }

    private static boolean looksLikeBsdTimestamp(String s) {
        // "Oct 11 22:14:15"
        return Character.isLetter(s.charAt(0))
            && s.charAt(3) == ' '
            && s.charAt(6) == ' '
            && s.charAt(9) == ':'
            && s.charAt(12) == ':';
    }

    private static void putUnlessNil(Map<String, String> fields, String key, String value) {
        if (!value.isEmpty() && !NIL.equals(value)) {
            fields.put(key, value);
        }
    }

    private static final class Cursor {
        private final String s;
        private int pos;

        Cursor(String s, int pos) {
            this.s = s;
            this.pos = pos;
        }

        String token() {
            skipSpaces();
            int start = pos;
            while (pos < s.length() && s.charAt(pos) != ' ') {
                pos++;
            }
            return s.substring(start, pos);
        }

        void skipStructuredData() {
            skipSpaces();
            if (pos >= s.length()) {
                return;
            }
            if (s.charAt(pos) == '-') {
                pos++;
                return;
            }
            while (pos < s.length() && s.charAt(pos) == '[') {
                boolean inQuotes = false;
                pos++;
                while (pos < s.length()) {
                    char ch = s.charAt(pos);
                    if (ch == '\\' && inQuotes) {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    if (ch == '"') {
                        inQuotes = !inQuotes;
                    } else if (ch == ']' && !inQuotes) {
                        break;
                    }
                }
            }
        }

        String rest() {
            if (pos < s.length() && s.charAt(pos) == ' ') {
                pos++;
            }
            return pos >= s.length() ? "" : s.substring(pos);
        }

        private void skipSpaces() {
            while (pos < s.length() && s.charAt(pos) == ' ') {
                pos++;
            }
        }
    }
}
