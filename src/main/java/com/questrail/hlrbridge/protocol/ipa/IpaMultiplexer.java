package com.questrail.hlrbridge.protocol.ipa;

import com.questrail.hlrbridge.observability.BridgeErrorEvent;
import com.questrail.hlrbridge.observability.BridgeObservabilitySink;
import com.questrail.hlrbridge.observability.ConnectionEvent;
import com.questrail.hlrbridge.observability.FrameDroppedEvent;
import com.questrail.hlrbridge.protocol.ipa.codec.IpaFrameDecoder;
import com.questrail.hlrbridge.protocol.ipa.codec.impl.AccumulatingIpaFrameDecoder;
import com.questrail.hlrbridge.transport.StreamTransport;
import com.questrail.hlrbridge.transport.StreamTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * IpaMultiplexer
 * =============================================================================
 * Per-connection IPA demultiplexer.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   StreamTransport chunks
 *        → IpaFrameDecoder            (reassembly)
 *            → IpaFrame
 *                → CCM handler        (stream 0xFE)
 *                → OSMO route         (stream 0xEE, by extension selector)
 * </pre>
 *
 * <h2>Dropped frames</h2>
 * The following are logged and discarded; the connection stays up:
 * <ul>
 *   <li>unknown stream id</li>
 *   <li>empty CCM payload, OSMO frame without extension byte</li>
 *   <li>unknown extension selector</li>
 *   <li>known extension with no handler (OAP)</li>
 * </ul>
 *
 * <h2>Failure isolation</h2>
 * An exception thrown while handling one frame is reported to the
 * observability sink and decoding continues with the next frame.
 *
 * <p>One instance per connection; callbacks must be serialized.</p>
 */
public final class IpaMultiplexer implements StreamTransportListener, IpaFrameDecoder.Sink
{
    private static final Logger log = LoggerFactory.getLogger(IpaMultiplexer.class);

    private final IpaRoutesFactory routesFactory;
    private final IpaFrameDecoder decoder;
    private final BridgeObservabilitySink sink;

    private StreamTransport transport;
    private IpaRoutes routes;

    public IpaMultiplexer(IpaRoutesFactory routesFactory, BridgeObservabilitySink sink)
    {
        this(routesFactory, new AccumulatingIpaFrameDecoder(), sink);
    }

    public IpaMultiplexer(IpaRoutesFactory routesFactory,
                          IpaFrameDecoder decoder,
                          BridgeObservabilitySink sink)
    {
        this.routesFactory = Objects.requireNonNull(routesFactory, "routesFactory");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // -------------------------------------------------------------------------
    // StreamTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected(StreamTransport transport)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.routes = routesFactory.create(transport);
        sink.onConnection(ConnectionEvent.up(transport.remoteAddress()));
    }

    @Override
    public void onData(byte[] chunk)
    {
        if (routes == null) {
            log.warn("Discarding {} bytes received before connection setup", chunk.length);
            return;
        }

        // A throwing handler aborts decode(); the remaining frames stay buffered,
        // so keep draining until the decoder completes normally.
        byte[] next = chunk;
        while (true) {
            try {
                decoder.decode(next, this);
                return;
            }
            catch (RuntimeException e) {
                sink.onError(BridgeErrorEvent.of("Failed to handle IPA frame from " + remote(), e));
                next = new byte[0];
            }
        }
    }

    @Override
    public void onClosed(Throwable cause)
    {
        int pending = decoder.bufferedBytes();
        if (pending > 0) {
            log.debug("Discarding {} buffered bytes from {}", pending, remote());
        }
        decoder.reset();
        StreamTransport t = transport;
        sink.onConnection(ConnectionEvent.down(t == null ? null : t.remoteAddress(), cause));
        routes = null;
        transport = null;
    }

    // -------------------------------------------------------------------------
    // IpaFrameDecoder.Sink
    // -------------------------------------------------------------------------

    @Override
    public void onFrame(IpaFrame frame)
    {
        Optional<IpaStream> stream = IpaStream.fromId(frame.streamId());
        if (stream.isEmpty()) {
            drop(frame, "unknown stream");
            return;
        }

        switch (stream.get()) {
            case CCM -> {
                if (frame.payloadLength() == 0) {
                    drop(frame, "empty CCM payload");
                    return;
                }
                routes.ccm().onPayload(frame.payload());
            }
            case OSMO -> dispatchOsmo(frame);
        }
    }

    @Override
    public void onMalformedFrame(int streamId, String reason)
    {
        sink.onFrameDropped(FrameDroppedEvent.of(streamId, -1, reason));
    }

    private void dispatchOsmo(IpaFrame frame)
    {
        int selector = frame.extension().orElseThrow();
        Optional<OsmoExtension> extension = OsmoExtension.fromSelector(selector);
        if (extension.isEmpty()) {
            drop(frame, "unknown extension");
            return;
        }

        Optional<IpaPayloadHandler> handler = routes.osmo(extension.get());
        if (handler.isEmpty()) {
            log.debug("No handler for {} from {}, dropping {} bytes",
                    extension.get(), remote(), frame.payloadLength());
            return;
        }
        handler.get().onPayload(frame.payload());
    }

    private void drop(IpaFrame frame, String reason)
    {
        sink.onFrameDropped(FrameDroppedEvent.of(
                frame.streamId(), frame.extension().orElse(-1), reason));
    }

    private Object remote()
    {
        StreamTransport t = transport;
        return t == null ? "unknown peer" : t.remoteAddress();
    }
}
