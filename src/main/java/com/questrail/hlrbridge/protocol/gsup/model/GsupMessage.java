package com.questrail.hlrbridge.protocol.gsup.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * GsupMessage
 * -----------------------------------------------------------------------------
 * Semantic representation of one GSUP message: its {@link GsupMessageType} and
 * an ordered map of top-level information elements to decoded values.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Only top-level IE types may be carried; nested types are rejected.</li>
 *   <li>Each value is an instance of {@link InformationElementType#valueType()}.</li>
 *   <li>Insertion order is preserved so that re-encoding is deterministic.</li>
 * </ul>
 *
 * <p>Mandatory-IE presence is <em>not</em> checked here. The codec
 * enforces it on both decode and encode, which lets callers (and tests) build
 * incomplete messages and observe the codec rejecting them.</p>
 *
 * <p>Equality compares type and IE values, with byte arrays compared by
 * content. IE order does not participate in equality.</p>
 */
public final class GsupMessage
{
    private final GsupMessageType type;
    private final Map<InformationElementType, Object> ies;

    private GsupMessage(GsupMessageType type, LinkedHashMap<InformationElementType, Object> ies)
    {
        this.type = type;
        this.ies = Collections.unmodifiableMap(ies);
    }

    public static Builder builder(GsupMessageType type)
    {
        return new Builder(type);
    }

    public GsupMessageType type()
    {
        return type;
    }

    /**
     * Returns an unmodifiable, insertion-ordered view of the carried IEs.
     */
    public Map<InformationElementType, Object> ies()
    {
        return ies;
    }

    public boolean has(InformationElementType ieType)
    {
        return ies.containsKey(ieType);
    }

    /**
     * Returns the IMSI, or {@code null} if the message carries none.
     */
    public String imsi()
    {
        return (String) ies.get(InformationElementType.IMSI);
    }

    public OptionalInt cause()
    {
        Integer cause = (Integer) ies.get(InformationElementType.CAUSE);
        return cause == null ? OptionalInt.empty() : OptionalInt.of(cause);
    }

    public OptionalInt cnDomain()
    {
        Integer cn = (Integer) ies.get(InformationElementType.CN_DOMAIN);
        return cn == null ? OptionalInt.empty() : OptionalInt.of(cn);
    }

    public Optional<AuthVector> authVector()
    {
        return Optional.ofNullable((AuthVector) ies.get(InformationElementType.AUTH_TUPLE));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof GsupMessage that)) return false;
        if (type != that.type || ies.size() != that.ies.size()) return false;
        for (Map.Entry<InformationElementType, Object> e : ies.entrySet()) {
            if (!that.ies.containsKey(e.getKey())) return false;
            if (!Objects.deepEquals(e.getValue(), that.ies.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode()
    {
        int h = type.hashCode();
        for (Map.Entry<InformationElementType, Object> e : ies.entrySet()) {
            Object v = e.getValue();
            int vh = v instanceof byte[] bytes ? Arrays.hashCode(bytes) : v.hashCode();
            h += e.getKey().hashCode() ^ vh;
        }
        return h;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("GsupMessage[").append(type);
        for (Map.Entry<InformationElementType, Object> e : ies.entrySet()) {
            Object v = e.getValue();
            sb.append(", ").append(e.getKey()).append('=');
            sb.append(v instanceof byte[] bytes ? HexFormat.of().formatHex(bytes) : v);
        }
        return sb.append(']').toString();
    }

    public static final class Builder
    {
        private final GsupMessageType type;
        private final LinkedHashMap<InformationElementType, Object> ies = new LinkedHashMap<>();

        private Builder(GsupMessageType type)
        {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder imsi(String imsi)
        {
            return put(InformationElementType.IMSI, imsi);
        }

        public Builder cause(int cause)
        {
            return put(InformationElementType.CAUSE, cause);
        }

        public Builder cause(ErrorCause cause)
        {
            return put(InformationElementType.CAUSE, cause.code());
        }

        public Builder cnDomain(int cnDomain)
        {
            return put(InformationElementType.CN_DOMAIN, cnDomain);
        }

        public Builder authVector(AuthVector vector)
        {
            return put(InformationElementType.AUTH_TUPLE, vector);
        }

        public Builder pdpInfoComplete(byte[] value)
        {
            return put(InformationElementType.PDP_INFO_COMPLETE, value);
        }

        public Builder pdpInfo(byte[] value)
        {
            return put(InformationElementType.PDP_INFO, value);
        }

        /**
         * Adds (or replaces) an IE. A later put for the same type wins but keeps
         * the position of the first insertion.
         *
         * @throws IllegalArgumentException for nested IE types or a value of the
         *                                  wrong Java type
         */
        public Builder put(InformationElementType ieType, Object value)
        {
            Objects.requireNonNull(ieType, "ieType");
            Objects.requireNonNull(value, "value");
            if (ieType.isNested()) {
                throw new IllegalArgumentException(ieType + " is only valid inside another IE");
            }
            if (!ieType.valueType().isInstance(value)) {
                throw new IllegalArgumentException(
                        ieType + " expects " + ieType.valueType().getSimpleName()
                                + " but got " + value.getClass().getSimpleName());
            }
            ies.put(ieType, value instanceof byte[] bytes ? bytes.clone() : value);
            return this;
        }

        public GsupMessage build()
        {
            return new GsupMessage(type, new LinkedHashMap<>(ies));
        }
    }
}
