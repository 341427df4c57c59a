package com.questrail.hlrbridge.protocol.gsup.codec;

import java.util.Objects;

/**
 * Indicates that GSUP bytes could not be translated into a semantic message, or
 * that a message could not be rendered to bytes.
 *
 * <p>The {@link Kind} classifies the failure:</p>
 * <ul>
 *   <li>{@link Kind#EMPTY_MESSAGE}: zero-length input</li>
 *   <li>{@link Kind#UNKNOWN_MESSAGE_TYPE}: first byte is not a known type</li>
 *   <li>{@link Kind#TRUNCATED_IE}: an IE value runs past the end of the message</li>
 *   <li>{@link Kind#INVALID_LENGTH}: an IE length is outside its bounds</li>
 *   <li>{@link Kind#INVALID_VALUE}: an IE value cannot be represented</li>
 *   <li>{@link Kind#MISSING_MANDATORY_IE}: see {@link MissingMandatoryIeException}</li>
 * </ul>
 */
public class GsupCodecException extends RuntimeException
{
    public enum Kind
    {
        EMPTY_MESSAGE,
        UNKNOWN_MESSAGE_TYPE,
        TRUNCATED_IE,
        INVALID_LENGTH,
        INVALID_VALUE,
        MISSING_MANDATORY_IE
    }

    private final Kind kind;

    public GsupCodecException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GsupCodecException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}
