package com.questrail.hlrbridge.protocol.gsup.codec;

import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;

/**
 * InformationElementCodec
 * -----------------------------------------------------------------------------
 * Value-level translation for a single top-level IE.
 *
 * <p>Length bounds are checked before any type-specific routine runs, in both
 * directions. A violation is reported as
 * {@link GsupCodecException.Kind#INVALID_LENGTH}; a value that cannot be
 * represented at all (non-digit IMSI, byte out of range) as
 * {@link GsupCodecException.Kind#INVALID_VALUE}.</p>
 */
public interface InformationElementCodec
{
    /**
     * Decodes the value bytes of an IE of the given type.
     *
     * @return a value of {@link InformationElementType#valueType()}
     */
    Object decode(InformationElementType type, byte[] value);

    /**
     * Encodes a value of {@link InformationElementType#valueType()}.
     */
    byte[] encode(InformationElementType type, Object value);

    /**
     * Maximum encoded value length for the given type.
     */
    int maxLength(InformationElementType type);
}
