package com.questrail.hlrbridge.protocol.gsup.manager;

import com.questrail.hlrbridge.observability.BridgeErrorEvent;
import com.questrail.hlrbridge.observability.BridgeObservabilitySink;
import com.questrail.hlrbridge.observability.MessageEvent;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupCodecException;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupMessageCodec;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessage;
import com.questrail.hlrbridge.protocol.ipa.IpaPayloadHandler;
import com.questrail.hlrbridge.protocol.ipa.IpaWriteBuffer;
import com.questrail.hlrbridge.protocol.ipa.IpaWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * GsupManager
 * =============================================================================
 * Protocol manager for the OSMO/GSUP extension of one connection.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   payload
 *        → GsupMessageCodec.decode
 *            → GsupRequestHandler.apply
 *                → (optional) send
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   GsupMessage
 *        → IpaWriter.allocate(maxEncodedSize)
 *            → GsupMessageCodec.encode  (into the frame buffer)
 *                → IpaWriter.resetLength / write
 * </pre>
 *
 * <p>A payload that fails to decode is dropped and reported with its bytes in
 * hex; the connection is unaffected. Encode failures are programmer errors and
 * propagate to the caller.</p>
 */
public final class GsupManager implements IpaPayloadHandler
{
    private static final Logger log = LoggerFactory.getLogger(GsupManager.class);

    private final IpaWriter writer;
    private final GsupMessageCodec codec;
    private final GsupRequestHandler handler;
    private final BridgeObservabilitySink sink;

    public GsupManager(IpaWriter writer,
                       GsupMessageCodec codec,
                       GsupRequestHandler handler,
                       BridgeObservabilitySink sink)
    {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onPayload(byte[] payload)
    {
        final GsupMessage request;
        try {
            request = codec.decode(payload);
        }
        catch (GsupCodecException e) {
            String hex = HexFormat.of().formatHex(payload);
            log.warn("Dropping undecodable GSUP message ({}): {}", e.kind(), hex);
            sink.onError(BridgeErrorEvent.of("GSUP decode failed for payload " + hex, e));
            return;
        }

        sink.onMessage(MessageEvent.inbound(request.type(), request.imsi()));
        log.debug("Received {}", request);

        Optional<GsupMessage> response = handler.apply(request);
        response.ifPresent(this::send);
    }

    /**
     * Encode {@code message} directly into an IPA frame buffer and write it.
     *
     * @throws GsupCodecException if the message cannot be encoded
     */
    public void send(GsupMessage message)
    {
        Objects.requireNonNull(message, "message");

        IpaWriteBuffer out = writer.allocate(codec.maxEncodedSize(message));
        int end = codec.encode(message, out.buffer(), out.payloadOffset());
        int length = end - out.payloadOffset();
        writer.resetLength(out, length);
        writer.write(out, length);

        sink.onMessage(MessageEvent.outbound(message.type(), message.imsi()));
        log.debug("Sent {}", message);
    }
}
