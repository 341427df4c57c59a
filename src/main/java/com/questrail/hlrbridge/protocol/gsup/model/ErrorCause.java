package com.questrail.hlrbridge.protocol.gsup.model;

import java.util.Optional;

/**
 * Known values of the Cause IE.
 *
 * <p>The Cause IE itself decodes to its raw integer so that causes outside this
 * list survive a decode/re-encode unchanged; use {@link #fromCode(int)} to
 * interpret one.</p>
 */
public enum ErrorCause
{
    IMSI_UNKNOWN(0x02),
    NETWORK_FAILURE(0x11),
    PROTOCOL_ERROR(0x6F);

    private final int code;

    ErrorCause(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<ErrorCause> fromCode(int code)
    {
        for (ErrorCause cause : values()) {
            if (cause.code == code) {
                return Optional.of(cause);
            }
        }
        return Optional.empty();
    }
}
