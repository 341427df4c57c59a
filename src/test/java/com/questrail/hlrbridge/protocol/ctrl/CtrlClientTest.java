package com.questrail.hlrbridge.protocol.ctrl;

import com.questrail.hlrbridge.observability.NullObservabilitySink;
import com.questrail.hlrbridge.transport.FakeStreamTransport;
import com.questrail.hlrbridge.transport.StreamConnector;
import com.questrail.hlrbridge.transport.StreamTransport;
import com.questrail.hlrbridge.transport.StreamTransportListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CtrlClientTest
 * -----------------------------------------------------------------------------
 * One-shot CTRL exchanges against an in-memory connector.
 */
final class CtrlClientTest
{
    private static final SocketAddress REMOTE = new InetSocketAddress("127.0.0.1", CtrlClient.DEFAULT_PORT);

    private FakeConnector connector;
    private CtrlClient client;

    @BeforeEach
    void setUp()
    {
        connector = new FakeConnector();
        client = new CtrlClient(connector, NullObservabilitySink.INSTANCE);
    }

    @Test
    void sendsCommandOnConnect()
    {
        client.execute(REMOTE, new CtrlCommand(CtrlCommand.Action.GET, 12345, "bts.0.location", null));

        byte[] frame = connector.transport.writes().get(0);
        assertEquals((byte) 0xEE, frame[2]);
        assertEquals(0x00, frame[3]);
        assertEquals("GET 12345 bts.0.location", new String(frame, 4, frame.length - 4, StandardCharsets.US_ASCII));
    }

    @Test
    void completesWithMatchingReplyAndCloses() throws Exception
    {
        CompletableFuture<CtrlResponse> result =
                client.execute(REMOTE, new CtrlCommand(CtrlCommand.Action.SET, 10001, "x", "1"));

        reply("SET_REPLY 10001 x 1");

        CtrlResponse response = result.get();
        assertEquals("1", response.value());
        assertTrue(connector.transport.isClosed());
    }

    @Test
    void failsOnMismatchedId()
    {
        CompletableFuture<CtrlResponse> result =
                client.execute(REMOTE, new CtrlCommand(CtrlCommand.Action.GET, 10001, "x", null));

        reply("GET_REPLY 10002 x 1");

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(CtrlMessageIdException.class, e.getCause());
        assertTrue(connector.transport.isClosed());
    }

    @Test
    void failsOnErrorReply()
    {
        CompletableFuture<CtrlResponse> result =
                client.execute(REMOTE, new CtrlCommand(CtrlCommand.Action.GET, 10001, "x", null));

        reply("ERROR 10001 Command not found");

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertEquals("Command not found", ((CtrlErrorResponseException) e.getCause()).error());
    }

    @Test
    void failsWhenConnectionDropsFirst()
    {
        CompletableFuture<CtrlResponse> result = client.execute(REMOTE, CtrlCommand.get("x"));

        connector.transport.drop(new IOException("reset"));

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(CtrlException.class, e.getCause());
        assertEquals("reset", e.getCause().getCause().getMessage());
    }

    @Test
    void failsWhenConnectFails()
    {
        connector.failure = new IOException("refused");

        CompletableFuture<CtrlResponse> result = client.execute(REMOTE, CtrlCommand.get("x"));

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertEquals("refused", e.getCause().getMessage());
    }

    @Test
    void answersPingWhileWaiting()
    {
        client.execute(REMOTE, CtrlCommand.get("x"));
        connector.transport.clear();

        connector.transport.inject(new byte[] { 0x00, 0x01, (byte) 0xFE, 0x00 });

        assertArrayEquals(new byte[] { 0x00, 0x01, (byte) 0xFE, 0x01 }, connector.transport.writes().get(0));
    }

    private void reply(String text)
    {
        byte[] body = text.getBytes(StandardCharsets.US_ASCII);
        byte[] frame = new byte[4 + body.length];
        frame[0] = (byte) ((body.length + 1) >> 8);
        frame[1] = (byte) (body.length + 1);
        frame[2] = (byte) 0xEE;
        frame[3] = 0x00;
        System.arraycopy(body, 0, frame, 4, body.length);
        connector.transport.inject(frame);
    }

    private static final class FakeConnector implements StreamConnector
    {
        FakeStreamTransport transport;
        IOException failure;

        @Override
        public CompletableFuture<StreamTransport> connect(SocketAddress remote, StreamTransportListener listener)
        {
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            transport = new FakeStreamTransport(remote);
            transport.connect(listener);
            return CompletableFuture.completedFuture(transport);
        }

        @Override
        public void shutdown()
        {
        }
    }
}
