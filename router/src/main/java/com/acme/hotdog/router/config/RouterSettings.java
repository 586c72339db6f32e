package com.acme.hotdog.router.config;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated runtime settings derived from {@link HotdogSettings}.
 *
 * @param listener       inbound syslog listener
 * @param statusAddress  bind address of the status endpoint
 * @param buffer         hard cap on envelopes held by the dispatcher
 * @param producerConfig sink client settings, passed through verbatim
 * @param defaultTopic   topic used when no rule sets one
 * @param statsd         metrics collector address, or null when metrics push is off
 */
public record RouterSettings(
    ListenerSettings listener,
    InetSocketAddress statusAddress,
    int buffer,
    Map<String, String> producerConfig,
    String defaultTopic,
    InetSocketAddress statsd
) {
    public RouterSettings {
        producerConfig = Collections.unmodifiableMap(new LinkedHashMap<>(producerConfig));
    }
}
