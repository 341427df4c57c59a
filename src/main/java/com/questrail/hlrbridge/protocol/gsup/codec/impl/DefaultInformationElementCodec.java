package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException.Kind;
import com.questrail.hlrbridge.protocol.gsup.codec.InformationElementCodec;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultInformationElementCodec
 * -----------------------------------------------------------------------------
 * Table-driven {@link InformationElementCodec}.
 *
 * <p>Value length bounds (bytes, inclusive):</p>
 * <ul>
 *   <li>IMSI: 0..8</li>
 *   <li>Cause: 1..1</li>
 *   <li>AuthTuple: 34..34</li>
 *   <li>PDP-Info-Complete: 0..0</li>
 *   <li>PDP-Info: 10..109</li>
 *   <li>CN-Domain: 1..1</li>
 * </ul>
 *
 * <p>Nested IE types have no entry and are rejected by every method.</p>
 */
public final class DefaultInformationElementCodec implements InformationElementCodec
{
    public static final DefaultInformationElementCodec INSTANCE = new DefaultInformationElementCodec();

    private final Map<InformationElementType, InformationElementSpec> specs =
            new EnumMap<>(InformationElementType.class);

    private DefaultInformationElementCodec()
    {
        specs.put(InformationElementType.IMSI, new InformationElementSpec(0, 8,
                InformationElementRoutines::decodeImsi, InformationElementRoutines::encodeImsi));
        specs.put(InformationElementType.CAUSE, new InformationElementSpec(1, 1,
                InformationElementRoutines::decodeNumber, InformationElementRoutines::encodeNumber));
        specs.put(InformationElementType.AUTH_TUPLE, new InformationElementSpec(
                InformationElementRoutines.AUTH_TUPLE_LENGTH, InformationElementRoutines.AUTH_TUPLE_LENGTH,
                InformationElementRoutines::decodeAuthTuple, InformationElementRoutines::encodeAuthTuple));
        specs.put(InformationElementType.PDP_INFO_COMPLETE, new InformationElementSpec(0, 0,
                InformationElementRoutines::decodeBytes, InformationElementRoutines::encodeBytes));
        specs.put(InformationElementType.PDP_INFO, new InformationElementSpec(10, 109,
                InformationElementRoutines::decodeBytes, InformationElementRoutines::encodePdpInfo));
        specs.put(InformationElementType.CN_DOMAIN, new InformationElementSpec(1, 1,
                InformationElementRoutines::decodeNumber, InformationElementRoutines::encodeNumber));
    }

    @Override
    public Object decode(InformationElementType type, byte[] value)
    {
        Objects.requireNonNull(value, "value");
        InformationElementSpec spec = specFor(type);

        if (!spec.accepts(value.length)) {
            throw new GsupCodecException(Kind.INVALID_LENGTH, lengthMessage(type, spec, value.length));
        }
        return spec.decoder().apply(value);
    }

    @Override
    public byte[] encode(InformationElementType type, Object value)
    {
        Objects.requireNonNull(value, "value");
        InformationElementSpec spec = specFor(type);

        if (!type.valueType().isInstance(value)) {
            throw new GsupCodecException(Kind.INVALID_VALUE,
                    type + " expects " + type.valueType().getSimpleName());
        }

        byte[] encoded = spec.encoder().apply(value);
        if (!spec.accepts(encoded.length)) {
            throw new GsupCodecException(Kind.INVALID_LENGTH, lengthMessage(type, spec, encoded.length));
        }
        return encoded;
    }

    @Override
    public int maxLength(InformationElementType type)
    {
        return specFor(type).maxLength();
    }

    private InformationElementSpec specFor(InformationElementType type)
    {
        Objects.requireNonNull(type, "type");
        InformationElementSpec spec = specs.get(type);
        if (spec == null) {
            throw new IllegalArgumentException(type + " is not a top-level IE");
        }
        return spec;
    }

    private static String lengthMessage(InformationElementType type, InformationElementSpec spec, int length)
    {
        return type + " length " + length + " outside " + spec.minLength() + ".." + spec.maxLength();
    }
}
