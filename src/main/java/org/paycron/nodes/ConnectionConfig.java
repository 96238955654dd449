package org.paycron.nodes;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to reach the payment node. Immutable, shared by every
 * dispatched firing.
 */
public record ConnectionConfig(
        String serverUrl,
        Path certPath,
        Path macaroonPath,
        Duration connectTimeout
) {
    public ConnectionConfig {
        Objects.requireNonNull(serverUrl, "serverUrl");
        if (serverUrl.endsWith("/")) {
            serverUrl = serverUrl.substring(0, serverUrl.length() - 1);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
    }
}
