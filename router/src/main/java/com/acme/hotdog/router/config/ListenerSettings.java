package com.acme.hotdog.router.config;

import java.nio.file.Path;

/**
 * Validated inbound listener settings. {@code tlsCert} and {@code tlsKey} are both
 * null for plaintext listening.
 */
public record ListenerSettings(String address, int port, Path tlsCert, Path tlsKey) {
    public boolean tlsEnabled() {
        return tlsCert != null && tlsKey != null;
    }
}
