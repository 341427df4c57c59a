package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException.Kind;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupMessageCodec;
import com.questrail.hlrbridge.protocol.gsup.codec.InformationElementCodec;
import com.questrail.hlrbridge.protocol.gsup.codec.MissingMandatoryIeException;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessage;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;
import com.questrail.hlrbridge.protocol.gsup.model.IePresence;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultGsupMessageCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link GsupMessageCodec}.
 *
 * <p>Decode performs the following steps, in order:</p>
 * <ol>
 *   <li>Reject an empty payload</li>
 *   <li>Resolve the message type from byte 0</li>
 *   <li>Walk {@code (type, len, value)} triples until fewer than two bytes
 *       remain; a single trailing byte is treated as padding</li>
 *   <li>Validate mandatory IE presence</li>
 * </ol>
 *
 * <p><strong>Unknown IE codes</strong> (including nested-only codes appearing at
 * top level) are skipped with a warning. A repeated known IE replaces the
 * earlier value.</p>
 *
 * <p>The codec holds no mutable state; {@link #INSTANCE} is shared by all
 * connections.</p>
 */
public final class DefaultGsupMessageCodec implements GsupMessageCodec
{
    private static final Logger log = LoggerFactory.getLogger(DefaultGsupMessageCodec.class);

    public static final DefaultGsupMessageCodec INSTANCE =
            new DefaultGsupMessageCodec(DefaultInformationElementCodec.INSTANCE);

    private final InformationElementCodec ieCodec;

    public DefaultGsupMessageCodec(InformationElementCodec ieCodec)
    {
        this.ieCodec = Objects.requireNonNull(ieCodec, "ieCodec");
    }

    @Override
    public GsupMessage decode(byte[] buf, int offset, int length)
    {
        Objects.requireNonNull(buf, "buf");
        Objects.checkFromIndexSize(offset, length, buf.length);

        if (length == 0) {
            throw new GsupCodecException(Kind.EMPTY_MESSAGE, "Empty GSUP message");
        }

        final int typeCode = buf[offset] & 0xFF;
        final GsupMessageType type = GsupMessageType.fromCode(typeCode)
                .orElseThrow(() -> new GsupCodecException(Kind.UNKNOWN_MESSAGE_TYPE,
                        String.format("Unknown GSUP message type 0x%02X", typeCode)));

        final GsupMessage.Builder builder = GsupMessage.builder(type);
        final int end = offset + length;
        int pos = offset + 1;

        while (end - pos >= 2) {
            final int ieCode = buf[pos] & 0xFF;
            final int ieLength = buf[pos + 1] & 0xFF;
            pos += 2;

            Optional<InformationElementType> ieType = InformationElementType.topLevel(ieCode);
            if (ieType.isEmpty()) {
                log.warn("Skipping unknown IE 0x{} ({} bytes) in {}",
                        String.format("%02X", ieCode), ieLength, type);
                pos += ieLength;
                continue;
            }

            if (pos + ieLength > end) {
                throw new GsupCodecException(Kind.TRUNCATED_IE,
                        ieType.get() + " declares " + ieLength + " bytes but only "
                                + (end - pos) + " remain");
            }

            byte[] value = Arrays.copyOfRange(buf, pos, pos + ieLength);
            builder.put(ieType.get(), ieCodec.decode(ieType.get(), value));
            pos += ieLength;
        }

        GsupMessage message = builder.build();
        requireMandatory(message);
        return message;
    }

    @Override
    public int encode(GsupMessage message, byte[] buf, int offset)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(buf, "buf");
        requireMandatory(message);

        // Encode every value before writing so a failing IE leaves buf untouched.
        byte[][] values = new byte[message.ies().size()][];
        InformationElementType[] types = new InformationElementType[values.length];
        int total = 1;
        int i = 0;
        for (Map.Entry<InformationElementType, Object> e : message.ies().entrySet()) {
            types[i] = e.getKey();
            values[i] = ieCodec.encode(e.getKey(), e.getValue());
            total += 2 + values[i].length;
            i++;
        }
        Objects.checkFromIndexSize(offset, total, buf.length);

        int pos = offset;
        buf[pos++] = (byte) message.type().code();
        for (i = 0; i < values.length; i++) {
            buf[pos++] = (byte) types[i].code();
            buf[pos++] = (byte) values[i].length;
            System.arraycopy(values[i], 0, buf, pos, values[i].length);
            pos += values[i].length;
        }
        return pos;
    }

    @Override
    public byte[] encode(GsupMessage message)
    {
        byte[] buf = new byte[maxEncodedSize(message)];
        int end = encode(message, buf, 0);
        return Arrays.copyOf(buf, end);
    }

    @Override
    public int maxEncodedSize(GsupMessage message)
    {
        int size = 1;
        for (InformationElementType type : message.ies().keySet()) {
            size += 2 + ieCodec.maxLength(type);
        }
        return size;
    }

    private static void requireMandatory(GsupMessage message)
    {
        for (Map.Entry<InformationElementType, IePresence> e : GsupMessageFormat.of(message.type()).entrySet()) {
            if (e.getValue() == IePresence.MANDATORY && !message.has(e.getKey())) {
                throw new MissingMandatoryIeException(message.type(), e.getKey());
            }
        }
    }
}
