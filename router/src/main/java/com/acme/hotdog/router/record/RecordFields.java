package com.acme.hotdog.router.record;

import java.util.Set;

/**
 * Field names a {@link LogRecord} can carry. Rules may only target these.
 */
public final class RecordFields {
    public static final String MSG = "msg";
    public static final String HOSTNAME = "hostname";
    public static final String APPNAME = "appname";
    public static final String PROCID = "procid";
    public static final String MSGID = "msgid";
    public static final String SEVERITY = "severity";
    public static final String FACILITY = "facility";
    public static final String TIMESTAMP = "timestamp";

    public static final Set<String> KNOWN = Set.of(
        MSG, HOSTNAME, APPNAME, PROCID, MSGID, SEVERITY, FACILITY, TIMESTAMP
    );

    private RecordFields() {
    }

    public static boolean isKnown(String field) {
        return field != null && KNOWN.contains(field);
    }
}
