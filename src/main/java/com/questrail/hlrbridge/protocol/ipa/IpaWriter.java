package com.questrail.hlrbridge.protocol.ipa;

import com.questrail.hlrbridge.protocol.ipa.codec.impl.IpaFraming;
import com.questrail.hlrbridge.transport.StreamTransport;

import java.util.Objects;

/**
 * IpaWriter
 * -----------------------------------------------------------------------------
 * Outbound framing for one stream (and, on OSMO, one extension) of one
 * connection.
 *
 * <h2>Usage</h2>
 * <pre>
 *   IpaWriteBuffer out = writer.allocate(maxPayload);
 *   int end = encoder.encode(msg, out.buffer(), out.payloadOffset());
 *   int len = end - out.payloadOffset();
 *   writer.resetLength(out, len);
 *   writer.write(out, len);
 * </pre>
 *
 * <p>Header and payload share one allocation so the frame goes out in a single
 * transport call. No retries are performed here.</p>
 */
public final class IpaWriter
{
    private final StreamTransport transport;
    private final IpaStream stream;
    private final OsmoExtension extension;

    /**
     * Writer for a stream without extension byte (CCM).
     */
    public IpaWriter(StreamTransport transport, IpaStream stream)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.stream = Objects.requireNonNull(stream, "stream");
        if (stream.hasExtension()) {
            throw new IllegalArgumentException(stream + " requires an extension");
        }
        this.extension = null;
    }

    /**
     * Writer for one extension of the OSMO stream.
     */
    public IpaWriter(StreamTransport transport, OsmoExtension extension)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.stream = IpaStream.OSMO;
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    /**
     * Allocates header plus {@code payloadLength} bytes and writes the header
     * as if the payload were exactly that long.
     */
    public IpaWriteBuffer allocate(int payloadLength)
    {
        int offset = payloadOffset();
        byte[] buf = new byte[offset + payloadLength];
        IpaFraming.writeHeader(buf, 0, declaredLength(payloadLength), stream.id());
        if (extension != null) {
            buf[IpaFraming.HEADER_LENGTH] = (byte) extension.selector();
        }
        return new IpaWriteBuffer(buf, offset);
    }

    /**
     * Rewrites only the length field, for when the payload turned out shorter
     * than allocated.
     */
    public void resetLength(IpaWriteBuffer out, int payloadLength)
    {
        IpaFraming.writeLength(out.buffer(), 0, declaredLength(payloadLength));
    }

    /**
     * Sends header plus the first {@code payloadLength} payload bytes.
     */
    public void write(IpaWriteBuffer out, int payloadLength)
    {
        transport.write(out.buffer(), 0, out.payloadOffset() + payloadLength);
    }

    /**
     * Frames and sends a complete payload.
     */
    public void send(byte[] payload)
    {
        IpaWriteBuffer out = allocate(payload.length);
        System.arraycopy(payload, 0, out.buffer(), out.payloadOffset(), payload.length);
        write(out, payload.length);
    }

    public StreamTransport transport()
    {
        return transport;
    }

    private int payloadOffset()
    {
        return IpaFraming.HEADER_LENGTH + (extension != null ? 1 : 0);
    }

    private int declaredLength(int payloadLength)
    {
        return payloadLength + (extension != null ? 1 : 0);
    }
}
