package com.questrail.hlrbridge.observability;

import java.time.Instant;

/**
 * Record representing an IPA frame that was discarded.
 *
 * @param streamId  unsigned stream id of the frame
 * @param extension unsigned extension selector, or -1 if none was present
 * @param reason    short human-readable reason
 */
public record FrameDroppedEvent(
    Instant timestamp,
    int streamId,
    int extension,
    String reason
) {
    public static FrameDroppedEvent of(int streamId, int extension, String reason) {
        return new FrameDroppedEvent(Instant.now(), streamId, extension, reason);
    }
}
