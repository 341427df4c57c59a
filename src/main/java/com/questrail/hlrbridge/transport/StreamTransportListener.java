package com.questrail.hlrbridge.transport;

/**
 * StreamTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link StreamTransport}.
 *
 * <p>All callbacks for a given connection must be delivered in a
 * <em>serialized</em> manner by the implementation. Netty-backed transports
 * deliver them on the channel's event loop.</p>
 */
public interface StreamTransportListener
{
    /**
     * Called once when the connection is established and writable.
     */
    void onConnected(StreamTransport transport);

    /**
     * Called for each chunk of bytes received.
     *
     * <p>Chunk boundaries carry no meaning: a chunk may hold part of a frame,
     * exactly one frame, or several. The listener owns the array.</p>
     */
    void onData(byte[] chunk);

    /**
     * Called at most once when the connection becomes unusable.
     *
     * @param cause an exception or diagnostic cause; {@code null} for an
     *              orderly close
     */
    void onClosed(Throwable cause);
}
