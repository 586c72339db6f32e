package com.acme.hotdog.router.rules;

import com.acme.hotdog.router.util.BuildInfo;

import java.time.Clock;
import java.util.Objects;

/**
 * Process-wide values offered to templates: build version and wall clock.
 */
public record RuntimeValues(String version, Clock clock) {
    public RuntimeValues {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(clock, "clock");
    }

    public static RuntimeValues system() {
        return new RuntimeValues(BuildInfo.version(), Clock.systemUTC());
    }
}
