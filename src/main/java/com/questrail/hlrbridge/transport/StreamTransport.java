package com.questrail.hlrbridge.transport;

import java.net.SocketAddress;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Minimal port for one established byte-stream connection (TCP-style).
 *
 * <p>The transport carries bytes only. Framing, decoding and any response
 * policy live above it, in the IPA multiplexer and the protocol managers.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamTransport
{
    /**
     * Queue {@code length} bytes of {@code buf} starting at {@code offset} for
     * transmission.
     *
     * <p>The implementation copies what it needs before returning; the caller
     * may reuse {@code buf} immediately. No retries are performed here.</p>
     */
    void write(byte[] buf, int offset, int length);

    /**
     * Close the connection. The listener is notified through
     * {@link StreamTransportListener#onClosed(Throwable)}.
     */
    void close();

    /**
     * Remote peer address, for logging; may be {@code null} if unknown.
     */
    SocketAddress remoteAddress();
}
