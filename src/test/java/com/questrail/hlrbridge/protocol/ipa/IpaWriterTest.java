package com.questrail.hlrbridge.protocol.ipa;

import com.questrail.hlrbridge.transport.FakeStreamTransport;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

final class IpaWriterTest
{
    private static final HexFormat HEX = HexFormat.of();

    @Test
    void framesCcmPayload()
    {
        FakeStreamTransport transport = new FakeStreamTransport();
        new IpaWriter(transport, IpaStream.CCM).send(new byte[] { 0x01 });

        assertEquals("0001fe01", HEX.formatHex(transport.writes().get(0)));
    }

    @Test
    void lengthCountsExtensionByte()
    {
        FakeStreamTransport transport = new FakeStreamTransport();
        new IpaWriter(transport, OsmoExtension.CTRL).send("GET 1 x".getBytes());

        byte[] frame = transport.writes().get(0);
        assertEquals("0008ee00", HEX.formatHex(frame, 0, 4));
        assertEquals("GET 1 x", new String(frame, 4, frame.length - 4));
    }

    @Test
    void resetLengthShrinksFrame()
    {
        FakeStreamTransport transport = new FakeStreamTransport();
        IpaWriter writer = new IpaWriter(transport, OsmoExtension.GSUP);

        IpaWriteBuffer out = writer.allocate(100);
        assertEquals(4, out.payloadOffset());
        out.buffer()[4] = 0x08;
        out.buffer()[5] = 0x01;
        writer.resetLength(out, 2);
        writer.write(out, 2);

        assertEquals("0003ee050801", HEX.formatHex(transport.writes().get(0)));
    }

    @Test
    void osmoRequiresExtension()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new IpaWriter(new FakeStreamTransport(), IpaStream.OSMO));
    }
}
