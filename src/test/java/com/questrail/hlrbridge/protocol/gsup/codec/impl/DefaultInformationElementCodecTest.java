package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException;
import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;
import com.questrail.hlrbridge.protocol.gsup.model.PdpInfo;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultInformationElementCodecTest
 * -----------------------------------------------------------------------------
 * Value-level rules: length bounds, TBCD IMSI, AuthTuple layout, PDP-Info.
 */
final class DefaultInformationElementCodecTest
{
    private static final HexFormat HEX = HexFormat.of();

    private final DefaultInformationElementCodec codec = DefaultInformationElementCodec.INSTANCE;

    @Test
    void imsiDecodesLowNibbleFirst()
    {
        assertEquals("001555000001276",
                codec.decode(InformationElementType.IMSI, HEX.parseHex("00515500001072f6")));
    }

    @Test
    void oddLengthImsiIsPaddedWithFiller()
    {
        assertArrayEquals(HEX.parseHex("0051f5"), codec.encode(InformationElementType.IMSI, "00155"));
        assertEquals("00155", codec.decode(InformationElementType.IMSI, HEX.parseHex("0051f5")));
    }

    @Test
    void evenLengthImsiHasNoFiller()
    {
        assertArrayEquals(HEX.parseHex("1032"), codec.encode(InformationElementType.IMSI, "0123"));
    }

    @Test
    void emptyImsiIsWithinBounds()
    {
        assertArrayEquals(new byte[0], codec.encode(InformationElementType.IMSI, ""));
        assertEquals("", codec.decode(InformationElementType.IMSI, new byte[0]));
    }

    @Test
    void imsiWithLettersIsRejected()
    {
        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.encode(InformationElementType.IMSI, "asd"));
        assertEquals(GsupCodecException.Kind.INVALID_VALUE, e.kind());
    }

    @Test
    void imsiLongerThanBoundsIsRejected()
    {
        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.encode(InformationElementType.IMSI, "001555000001276001555000001"));
        assertEquals(GsupCodecException.Kind.INVALID_LENGTH, e.kind());
    }

    @Test
    void sixteenDigitImsiFitsExactly()
    {
        byte[] encoded = codec.encode(InformationElementType.IMSI, "0015550000012760");
        assertEquals(8, encoded.length);
    }

    @Test
    void nonBcdNibbleIsRejectedOnDecode()
    {
        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.decode(InformationElementType.IMSI, new byte[] { 0x1A }));
        assertEquals(GsupCodecException.Kind.INVALID_VALUE, e.kind());
    }

    @Test
    void imsiLongerThanEightBytesIsRejectedOnDecode()
    {
        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.decode(InformationElementType.IMSI, new byte[9]));
        assertEquals(GsupCodecException.Kind.INVALID_LENGTH, e.kind());
    }

    @Test
    void causeMustBeExactlyOneByte()
    {
        assertEquals(0x6F, codec.decode(InformationElementType.CAUSE, new byte[] { 0x6F }));

        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.decode(InformationElementType.CAUSE, new byte[] { 0x01, 0x01 }));
        assertEquals(GsupCodecException.Kind.INVALID_LENGTH, e.kind());
    }

    @Test
    void numberOutsideByteRangeIsRejected()
    {
        assertThrows(GsupCodecException.class, () -> codec.encode(InformationElementType.CN_DOMAIN, 256));
        assertThrows(GsupCodecException.class, () -> codec.encode(InformationElementType.CAUSE, -1));
    }

    @Test
    void authTupleLayout()
    {
        byte[] rand = HEX.parseHex("6e6989be6cee7154543770ae80b1ef0d");
        byte[] sres = HEX.parseHex("d4ac8b53");
        byte[] kc = HEX.parseHex("9ff5342eb95d8800");

        byte[] encoded = codec.encode(InformationElementType.AUTH_TUPLE, new AuthVector(rand, sres, kc));

        assertEquals(34, encoded.length);
        assertEquals("2010" + HEX.formatHex(rand) + "2104" + HEX.formatHex(sres) + "2208" + HEX.formatHex(kc),
                HEX.formatHex(encoded));
        assertEquals(new AuthVector(rand, sres, kc), codec.decode(InformationElementType.AUTH_TUPLE, encoded));
    }

    @Test
    void authTupleWithShortRandIsRejected()
    {
        AuthVector bad = new AuthVector(new byte[1], new byte[4], new byte[8]);
        GsupCodecException e = assertThrows(GsupCodecException.class,
                () -> codec.encode(InformationElementType.AUTH_TUPLE, bad));
        assertEquals(GsupCodecException.Kind.INVALID_LENGTH, e.kind());
    }

    @Test
    void pdpInfoAlwaysEncodesWildcardApn()
    {
        assertArrayEquals(HEX.parseHex("100101110201211202012a"),
                codec.encode(InformationElementType.PDP_INFO, new byte[] { 1, 2, 3 }));
        assertArrayEquals(PdpInfo.wildcardApn(), codec.encode(InformationElementType.PDP_INFO, new byte[0]));
    }

    @Test
    void pdpInfoDecodeReturnsRawBytes()
    {
        byte[] raw = PdpInfo.wildcardApn();
        assertArrayEquals(raw, (byte[]) codec.decode(InformationElementType.PDP_INFO, raw));

        assertThrows(GsupCodecException.class,
                () -> codec.decode(InformationElementType.PDP_INFO, new byte[9]));
    }

    @Test
    void pdpInfoCompleteIsEmpty()
    {
        assertArrayEquals(new byte[0], codec.encode(InformationElementType.PDP_INFO_COMPLETE, new byte[0]));
        assertThrows(GsupCodecException.class,
                () -> codec.encode(InformationElementType.PDP_INFO_COMPLETE, new byte[] { 1 }));
    }

    @Test
    void nestedTypesAreNotTopLevel()
    {
        assertThrows(IllegalArgumentException.class,
                () -> codec.decode(InformationElementType.RAND, new byte[16]));
    }

    @Test
    void everyTopLevelIeRejectsLengthsJustOutsideItsBounds()
    {
        Object[][] outside = {
                { InformationElementType.IMSI, 9 },
                { InformationElementType.CAUSE, 0 },
                { InformationElementType.CAUSE, 2 },
                { InformationElementType.AUTH_TUPLE, 33 },
                { InformationElementType.AUTH_TUPLE, 35 },
                { InformationElementType.PDP_INFO_COMPLETE, 1 },
                { InformationElementType.PDP_INFO, 9 },
                { InformationElementType.PDP_INFO, 110 },
                { InformationElementType.CN_DOMAIN, 0 },
                { InformationElementType.CN_DOMAIN, 2 },
        };

        for (Object[] c : outside) {
            InformationElementType type = (InformationElementType) c[0];
            int length = (Integer) c[1];
            GsupCodecException e = assertThrows(GsupCodecException.class,
                    () -> codec.decode(type, new byte[length]), type + " length " + length);
            assertEquals(GsupCodecException.Kind.INVALID_LENGTH, e.kind(), type + " length " + length);
        }
    }

    @Test
    void everyTopLevelIeAcceptsItsMaximumLength()
    {
        for (InformationElementType type : InformationElementType.values()) {
            if (type.isNested()) {
                continue;
            }
            // all-zero bytes are valid BCD, numbers and tuple payloads
            assertDoesNotThrow(() -> codec.decode(type, new byte[codec.maxLength(type)]), type.toString());
        }
    }

    @Test
    void maxLengths()
    {
        assertEquals(8, codec.maxLength(InformationElementType.IMSI));
        assertEquals(34, codec.maxLength(InformationElementType.AUTH_TUPLE));
        assertEquals(109, codec.maxLength(InformationElementType.PDP_INFO));
        assertEquals(0, codec.maxLength(InformationElementType.PDP_INFO_COMPLETE));
    }
}
