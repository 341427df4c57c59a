package com.questrail.hlrbridge.protocol.ipa;

import java.util.HexFormat;
import java.util.OptionalInt;

/**
 * IpaFrame
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one IPA frame.
 *
 * <h2>What this represents</h2>
 * A frame after it has been cut out of the byte stream: the stream id, the
 * extension selector (present only on the OSMO stream) and the payload that
 * follows. It is still <em>not</em> a protocol message; the payload is handed
 * unchanged to whichever handler the stream and selector route to.
 *
 * <h2>Length invariant</h2>
 * {@link #declaredLength()} equals the payload length plus one if an extension
 * byte is present. That is the value carried in the 16-bit length field.
 *
 * Immutability is enforced via defensive copying.
 */
public final class IpaFrame
{
    /** Unsigned stream id as received on the wire. */
    private final int streamId;

    /** Unsigned extension selector, or -1 when absent. */
    private final int extension;

    private final byte[] payload;

    public IpaFrame(int streamId, byte[] payload) {
        this(streamId, -1, payload);
    }

    public IpaFrame(int streamId, int extension, byte[] payload) {
        if (streamId < 0 || streamId > 0xFF) {
            throw new IllegalArgumentException("streamId out of range: " + streamId);
        }
        if (extension < -1 || extension > 0xFF) {
            throw new IllegalArgumentException("extension out of range: " + extension);
        }
        this.streamId = streamId;
        this.extension = extension;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public int streamId() {
        return streamId;
    }

    public OptionalInt extension() {
        return extension < 0 ? OptionalInt.empty() : OptionalInt.of(extension);
    }

    /**
     * Returns a copy of the payload bytes (after the extension byte, if any).
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    /**
     * Value of the wire length field for this frame.
     */
    public int declaredLength() {
        return payload.length + (extension < 0 ? 0 : 1);
    }

    @Override
    public String toString() {
        return "IpaFrame[" +
                "stream=0x" + Integer.toHexString(streamId) +
                (extension < 0 ? "" : ", extension=0x" + Integer.toHexString(extension)) +
                ", payload=" + HexFormat.of().formatHex(payload) +
                ']';
    }
}
