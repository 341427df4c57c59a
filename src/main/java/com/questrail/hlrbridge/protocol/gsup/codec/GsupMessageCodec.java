package com.questrail.hlrbridge.protocol.gsup.codec;

import com.questrail.hlrbridge.protocol.gsup.model.GsupMessage;

/**
 * GsupMessageCodec
 * -----------------------------------------------------------------------------
 * Translates between the GSUP payload bytes carried on the OSMO/GSUP stream and
 * {@link GsupMessage} instances.
 *
 * <p>Wire layout: {@code msg_type:u8} followed by zero or more
 * {@code (ie_type:u8, ie_len:u8, value)} triples.</p>
 *
 * <p>The codec is responsible for:</p>
 * <ul>
 *   <li>Recognizing the message type</li>
 *   <li>Walking IE triples, skipping unknown IE codes</li>
 *   <li>Delegating value translation to an {@link InformationElementCodec}</li>
 *   <li>Enforcing mandatory-IE presence in both directions</li>
 * </ul>
 *
 * <p>It is <strong>not</strong> responsible for IPA framing or for deciding how
 * to respond to a message. Implementations are stateless and may be shared.</p>
 *
 * <p>All failures surface as {@link GsupCodecException}.</p>
 */
public interface GsupMessageCodec
{
    /**
     * Decodes a complete GSUP payload.
     */
    default GsupMessage decode(byte[] payload)
    {
        return decode(payload, 0, payload.length);
    }

    /**
     * Decodes {@code length} bytes of {@code buf} starting at {@code offset}.
     */
    GsupMessage decode(byte[] buf, int offset, int length);

    /**
     * Encodes {@code message} into {@code buf} starting at {@code offset}.
     *
     * <p>Mandatory IEs are validated first; on failure nothing is written.
     * The buffer must hold at least {@link #maxEncodedSize(GsupMessage)} bytes
     * from {@code offset}.</p>
     *
     * @return the offset one past the last byte written
     */
    int encode(GsupMessage message, byte[] buf, int offset);

    /**
     * Encodes {@code message} into a freshly allocated array of exactly the
     * encoded size.
     */
    byte[] encode(GsupMessage message);

    /**
     * Upper bound on the encoded size of {@code message}: one type byte plus,
     * for every carried IE, two header bytes and that IE's maximum length.
     */
    int maxEncodedSize(GsupMessage message);
}
