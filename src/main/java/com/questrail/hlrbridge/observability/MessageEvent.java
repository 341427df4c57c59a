package com.questrail.hlrbridge.observability;

import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;

import java.time.Instant;

/**
 * Record representing one GSUP message crossing the bridge.
 */
public record MessageEvent(
    Instant timestamp,
    Direction direction,
    GsupMessageType type,
    String imsi
) {
    public enum Direction {
        INBOUND,
        OUTBOUND
    }

    public static MessageEvent inbound(GsupMessageType type, String imsi) {
        return new MessageEvent(Instant.now(), Direction.INBOUND, type, imsi);
    }

    public static MessageEvent outbound(GsupMessageType type, String imsi) {
        return new MessageEvent(Instant.now(), Direction.OUTBOUND, type, imsi);
    }
}
