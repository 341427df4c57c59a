package com.questrail.hlrbridge.protocol.gsup.model;

import java.util.Optional;

/**
 * GsupMessageType
 * -----------------------------------------------------------------------------
 * Closed set of GSUP message kinds handled by the bridge, each with its fixed
 * one-byte wire code.
 *
 * <p>Messages marked "from peer" are initiated by the radio stack; the others
 * are produced by the bridge (or are answers the peer sends back to a request
 * the bridge issued).</p>
 */
public enum GsupMessageType
{
    /** From peer. */
    UPDATE_LOCATION_REQUEST(0x04),
    UPDATE_LOCATION_ERROR(0x05),
    UPDATE_LOCATION_RESULT(0x06),

    /** From peer. */
    SEND_AUTH_INFO_REQUEST(0x08),
    SEND_AUTH_INFO_ERROR(0x09),
    SEND_AUTH_INFO_RESPONSE(0x0A),

    /** From peer; no reply expected. */
    AUTH_FAILURE_REPORT(0x0B),

    INSERT_SUBSCRIBER_DATA_REQUEST(0x10),
    /** From peer. */
    INSERT_SUBSCRIBER_DATA_ERROR(0x11),
    /** From peer. */
    INSERT_SUBSCRIBER_DATA_RESULT(0x12);

    private static final GsupMessageType[] BY_CODE = new GsupMessageType[256];

    static {
        for (GsupMessageType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    GsupMessageType(int code)
    {
        this.code = code;
    }

    /**
     * Returns the unsigned wire code.
     */
    public int code()
    {
        return code;
    }

    /**
     * Looks up a message type by its wire code.
     *
     * @param code unsigned byte value (0-255); other values never match
     */
    public static Optional<GsupMessageType> fromCode(int code)
    {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE[code]);
    }
}
