package com.questrail.hlrbridge.protocol.ctrl;

import com.questrail.hlrbridge.observability.BridgeObservabilitySink;
import com.questrail.hlrbridge.protocol.ipa.IpaMultiplexer;
import com.questrail.hlrbridge.protocol.ipa.IpaRoutes;
import com.questrail.hlrbridge.protocol.ipa.IpaStream;
import com.questrail.hlrbridge.protocol.ipa.IpaWriter;
import com.questrail.hlrbridge.protocol.ipa.OsmoExtension;
import com.questrail.hlrbridge.protocol.ipa.ccm.CcmKeepAliveHandler;
import com.questrail.hlrbridge.transport.StreamConnector;
import com.questrail.hlrbridge.transport.StreamTransport;
import com.questrail.hlrbridge.transport.StreamTransportListener;

import java.net.SocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * CtrlClient
 * =============================================================================
 * One-shot GET/SET client for the CTRL interface of a running radio stack.
 *
 * <h2>Exchange</h2>
 * <ol>
 *   <li>Connect to the remote CTRL port (4249 by default)</li>
 *   <li>Send the command on OSMO/CTRL</li>
 *   <li>Complete with the first response, checked by a
 *       {@link CtrlResponseCorrelator}</li>
 *   <li>Close the connection</li>
 * </ol>
 *
 * <p>The returned future fails with {@link CtrlMessageIdException} or
 * {@link CtrlErrorResponseException} for a bad response, and with
 * {@link CtrlException} if the connection ends before any response. No
 * timeout is applied here; callers bound the wait themselves.</p>
 */
public final class CtrlClient
{
    public static final int DEFAULT_PORT = 4249;

    private final StreamConnector connector;
    private final BridgeObservabilitySink sink;

    public CtrlClient(StreamConnector connector, BridgeObservabilitySink sink)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<CtrlResponse> execute(SocketAddress remote, CtrlCommand command)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(command, "command");

        CompletableFuture<CtrlResponse> result = new CompletableFuture<>();
        CtrlResponseCorrelator correlator = new CtrlResponseCorrelator(command.id());

        IpaMultiplexer multiplexer = new IpaMultiplexer(transport -> {
            CtrlManager ctrl = new CtrlManager(
                    new IpaWriter(transport, OsmoExtension.CTRL),
                    response -> {
                        try {
                            result.complete(correlator.accept(response));
                        }
                        catch (CtrlException e) {
                            result.completeExceptionally(e);
                        }
                        transport.close();
                    });
            ctrl.send(command);
            return new IpaRoutes(
                    new CcmKeepAliveHandler(new IpaWriter(transport, IpaStream.CCM)),
                    Map.of(OsmoExtension.CTRL, ctrl));
        }, sink);

        connector.connect(remote, new ClosingListener(multiplexer, result))
                .whenComplete((transport, error) -> {
                    if (error != null) {
                        result.completeExceptionally(error);
                    }
                });
        return result;
    }

    /**
     * Fails the pending exchange if the connection ends without a response.
     */
    private static final class ClosingListener implements StreamTransportListener
    {
        private final StreamTransportListener delegate;
        private final CompletableFuture<CtrlResponse> result;

        ClosingListener(StreamTransportListener delegate, CompletableFuture<CtrlResponse> result)
        {
            this.delegate = delegate;
            this.result = result;
        }

        @Override
        public void onConnected(StreamTransport transport)
        {
            delegate.onConnected(transport);
        }

        @Override
        public void onData(byte[] chunk)
        {
            delegate.onData(chunk);
        }

        @Override
        public void onClosed(Throwable cause)
        {
            delegate.onClosed(cause);
            if (!result.isDone()) {
                CtrlException e = new CtrlException("Connection closed before a CTRL response arrived");
                if (cause != null) {
                    e.initCause(cause);
                }
                result.completeExceptionally(e);
            }
        }
    }
}
