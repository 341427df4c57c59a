package com.questrail.hlrbridge.protocol.gsup.model;

import java.util.Optional;

/**
 * InformationElementType
 * -----------------------------------------------------------------------------
 * GSUP information element kinds and their one-byte wire codes.
 *
 * <p>Two groups share this enumeration:</p>
 * <ul>
 *   <li><b>Top-level</b> IEs, which appear directly inside a message and carry a
 *       decoded value of {@link #valueType()}.</li>
 *   <li><b>Nested</b> IEs (RAND, SRES, Kc, PDP context id, PDP type, APN name),
 *       which only occur inside the AuthTuple and PDP-Info values. Their codes
 *       overlap nothing at top level but are not recognized there either: a
 *       nested code seen at top level is treated as an unknown IE.</li>
 * </ul>
 */
public enum InformationElementType
{
    IMSI(0x01, String.class),
    CAUSE(0x02, Integer.class),
    AUTH_TUPLE(0x03, AuthVector.class),
    PDP_INFO_COMPLETE(0x04, byte[].class),
    PDP_INFO(0x05, byte[].class),
    CN_DOMAIN(0x28, Integer.class),

    RAND(0x20, null),
    SRES(0x21, null),
    KC(0x22, null),
    PDP_CONTEXT_ID(0x10, null),
    PDP_TYPE(0x11, null),
    APN_NAME(0x12, null);

    private static final InformationElementType[] TOP_LEVEL_BY_CODE = new InformationElementType[256];

    static {
        for (InformationElementType type : values()) {
            if (!type.isNested()) {
                TOP_LEVEL_BY_CODE[type.code] = type;
            }
        }
    }

    private final int code;
    private final Class<?> valueType;

    InformationElementType(int code, Class<?> valueType)
    {
        this.code = code;
        this.valueType = valueType;
    }

    public int code()
    {
        return code;
    }

    /**
     * Java type of the decoded value, or {@code null} for nested IEs which are
     * never carried as standalone values.
     */
    public Class<?> valueType()
    {
        return valueType;
    }

    public boolean isNested()
    {
        return valueType == null;
    }

    /**
     * Resolves a code appearing directly inside a GSUP message.
     */
    public static Optional<InformationElementType> topLevel(int code)
    {
        if (code < 0 || code >= TOP_LEVEL_BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(TOP_LEVEL_BY_CODE[code]);
    }
}
