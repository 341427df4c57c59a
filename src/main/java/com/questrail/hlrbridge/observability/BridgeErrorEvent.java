package com.questrail.hlrbridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bridge.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
    public static BridgeErrorEvent of(String message, Throwable cause) {
        return new BridgeErrorEvent(Instant.now(), message, cause);
    }
}
