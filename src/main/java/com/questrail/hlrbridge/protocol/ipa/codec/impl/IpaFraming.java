package com.questrail.hlrbridge.protocol.ipa.codec.impl;

import com.questrail.hlrbridge.protocol.ipa.codec.IpaFramingException;

/**
 * IpaFraming
 * -----------------------------------------------------------------------------
 * IPA header layout.
 *
 * <pre>
 *   +--------+--------+--------+-----------+-------------
 *   | len hi | len lo | stream | [ext]     | payload ...
 *   +--------+--------+--------+-----------+-------------
 * </pre>
 *
 * <p>{@code len} is big-endian and counts everything after the stream byte,
 * including the extension selector on the OSMO stream.</p>
 */
public final class IpaFraming
{
    public static final int HEADER_LENGTH = 3;

    public static final int MAX_LENGTH = 0xFFFF;

    private IpaFraming() {}

    public static int readLength(byte[] buf, int offset)
    {
        return ((buf[offset] & 0xFF) << 8) | (buf[offset + 1] & 0xFF);
    }

    public static int readStreamId(byte[] buf, int offset)
    {
        return buf[offset + 2] & 0xFF;
    }

    /**
     * Writes only the two length bytes at {@code offset}.
     *
     * @throws IpaFramingException if {@code length} does not fit 16 bits
     */
    public static void writeLength(byte[] buf, int offset, int length)
    {
        if (length < 0 || length > MAX_LENGTH) {
            throw new IpaFramingException("IPA length out of range: " + length);
        }
        buf[offset] = (byte) (length >>> 8);
        buf[offset + 1] = (byte) length;
    }

    public static void writeHeader(byte[] buf, int offset, int length, int streamId)
    {
        writeLength(buf, offset, length);
        buf[offset + 2] = (byte) streamId;
    }
}
