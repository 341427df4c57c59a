package com.questrail.hlrbridge.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound counterpart of a stream server: opens client connections.
 */
public interface StreamConnector
{
    /**
     * Connect to {@code remote} and attach {@code listener} to the new
     * connection.
     *
     * <p>The returned future completes once the listener has received
     * {@link StreamTransportListener#onConnected(StreamTransport)}, or
     * exceptionally if the connection could not be established.</p>
     */
    CompletableFuture<StreamTransport> connect(SocketAddress remote, StreamTransportListener listener);

    /**
     * Release all resources held by the connector. Open connections are closed.
     */
    void shutdown();
}
