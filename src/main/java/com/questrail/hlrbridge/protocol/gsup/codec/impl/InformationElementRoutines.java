package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException.Kind;
import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;
import com.questrail.hlrbridge.protocol.gsup.model.PdpInfo;

import java.util.Arrays;

/**
 * InformationElementRoutines
 * -----------------------------------------------------------------------------
 * Type-specific value translation for GSUP information elements.
 *
 * <p>These routines assume the caller has already checked the value length
 * against the IE bounds on decode. On encode they validate only what the
 * bounds cannot express (digit characters, field lengths inside the
 * AuthTuple, byte range).</p>
 */
final class InformationElementRoutines
{
    /** Total AuthTuple value length: three nested (tag, len, value) triples. */
    static final int AUTH_TUPLE_LENGTH =
            2 + AuthVector.RAND_LENGTH + 2 + AuthVector.SRES_LENGTH + 2 + AuthVector.KC_LENGTH;

    private static final int RAND_OFFSET = 2;
    private static final int SRES_OFFSET = RAND_OFFSET + AuthVector.RAND_LENGTH + 2;
    private static final int KC_OFFSET = SRES_OFFSET + AuthVector.SRES_LENGTH + 2;

    private static final int BCD_FILLER = 0x0F;

    private InformationElementRoutines() {}

    // -------------------------------------------------------------------------
    // IMSI: TBCD, low nibble first, odd length padded with 0xF
    // -------------------------------------------------------------------------

    static String decodeImsi(byte[] value)
    {
        StringBuilder digits = new StringBuilder(value.length * 2);
        for (byte b : value) {
            int low = b & 0x0F;
            int high = (b >> 4) & 0x0F;

            digits.append(bcdDigit(low));
            if (high == BCD_FILLER) {
                break;
            }
            digits.append(bcdDigit(high));
        }
        return digits.toString();
    }

    static byte[] encodeImsi(Object value)
    {
        String imsi = (String) value;
        for (int i = 0; i < imsi.length(); i++) {
            char c = imsi.charAt(i);
            if (c < '0' || c > '9') {
                throw new GsupCodecException(Kind.INVALID_VALUE, "IMSI contains non-digit character: " + imsi);
            }
        }

        byte[] out = new byte[(imsi.length() + 1) / 2];
        for (int i = 0; i < out.length; i++) {
            int low = imsi.charAt(2 * i) - '0';
            int high = (2 * i + 1 < imsi.length()) ? imsi.charAt(2 * i + 1) - '0' : BCD_FILLER;
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    private static char bcdDigit(int nibble)
    {
        if (nibble > 9) {
            throw new GsupCodecException(Kind.INVALID_VALUE,
                    String.format("Invalid BCD digit 0x%X in IMSI", nibble));
        }
        return (char) ('0' + nibble);
    }

    // -------------------------------------------------------------------------
    // Single-byte numbers (Cause, CN-Domain)
    // -------------------------------------------------------------------------

    static Integer decodeNumber(byte[] value)
    {
        return value[0] & 0xFF;
    }

    static byte[] encodeNumber(Object value)
    {
        int n = (Integer) value;
        if (n < 0 || n > 0xFF) {
            throw new GsupCodecException(Kind.INVALID_VALUE, "Value out of byte range: " + n);
        }
        return new byte[] { (byte) n };
    }

    // -------------------------------------------------------------------------
    // AuthTuple: [0x20,16,rand][0x21,4,sres][0x22,8,kc]
    // -------------------------------------------------------------------------

    static AuthVector decodeAuthTuple(byte[] value)
    {
        return new AuthVector(
                Arrays.copyOfRange(value, RAND_OFFSET, RAND_OFFSET + AuthVector.RAND_LENGTH),
                Arrays.copyOfRange(value, SRES_OFFSET, SRES_OFFSET + AuthVector.SRES_LENGTH),
                Arrays.copyOfRange(value, KC_OFFSET, KC_OFFSET + AuthVector.KC_LENGTH));
    }

    static byte[] encodeAuthTuple(Object value)
    {
        AuthVector vector = (AuthVector) value;
        byte[] out = new byte[AUTH_TUPLE_LENGTH];
        int pos = 0;
        pos = writeNested(out, pos, InformationElementType.RAND, vector.rand(), AuthVector.RAND_LENGTH);
        pos = writeNested(out, pos, InformationElementType.SRES, vector.sres(), AuthVector.SRES_LENGTH);
        writeNested(out, pos, InformationElementType.KC, vector.kc(), AuthVector.KC_LENGTH);
        return out;
    }

    private static int writeNested(byte[] out, int pos, InformationElementType type, byte[] field, int expected)
    {
        if (field.length != expected) {
            throw new GsupCodecException(Kind.INVALID_LENGTH,
                    type + " must be " + expected + " bytes, got " + field.length);
        }
        out[pos++] = (byte) type.code();
        out[pos++] = (byte) expected;
        System.arraycopy(field, 0, out, pos, expected);
        return pos + expected;
    }

    // -------------------------------------------------------------------------
    // PDP-Info and opaque bytes
    // -------------------------------------------------------------------------

    /**
     * Ignores its argument: only the wildcard APN is ever announced.
     */
    static byte[] encodePdpInfo(Object value)
    {
        return PdpInfo.wildcardApn();
    }

    static byte[] decodeBytes(byte[] value)
    {
        return value.clone();
    }

    static byte[] encodeBytes(Object value)
    {
        return ((byte[]) value).clone();
    }
}
