package com.questrail.hlrbridge.protocol.ipa.codec;

/**
 * Indicates that bytes could not be framed as IPA, or that a frame cannot be
 * rendered (payload too large for the 16-bit length field).
 */
public final class IpaFramingException extends RuntimeException
{
    public IpaFramingException(String message) {
        super(message);
    }

    public IpaFramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
