package com.questrail.hlrbridge.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a peer connection coming up or going down.
 *
 * @param cause diagnostic cause of a loss; {@code null} when up or closed cleanly
 */
public record ConnectionEvent(
    Instant timestamp,
    SocketAddress remote,
    boolean up,
    Throwable cause
) {
    public static ConnectionEvent up(SocketAddress remote) {
        return new ConnectionEvent(Instant.now(), remote, true, null);
    }

    public static ConnectionEvent down(SocketAddress remote, Throwable cause) {
        return new ConnectionEvent(Instant.now(), remote, false, cause);
    }
}
