package com.questrail.hlrbridge.protocol.ctrl;

import com.questrail.hlrbridge.protocol.ipa.IpaPayloadHandler;
import com.questrail.hlrbridge.protocol.ipa.IpaWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * CtrlManager
 * -----------------------------------------------------------------------------
 * Protocol manager for the OSMO/CTRL extension of one connection.
 *
 * <p>Inbound payloads are UTF-8 text parsed as {@link CtrlResponse} and handed
 * to the listener. Unparseable text is logged and dropped. Outbound commands
 * are framed through the writer bound to this connection.</p>
 */
public final class CtrlManager implements IpaPayloadHandler
{
    private static final Logger log = LoggerFactory.getLogger(CtrlManager.class);

    private final IpaWriter writer;
    private final Consumer<CtrlResponse> listener;

    public CtrlManager(IpaWriter writer, Consumer<CtrlResponse> listener)
    {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void onPayload(byte[] payload)
    {
        String text = new String(payload, StandardCharsets.UTF_8);
        final CtrlResponse response;
        try {
            response = CtrlResponse.parse(text);
        }
        catch (IllegalArgumentException e) {
            log.warn("Dropping CTRL message from {}: {}", writer.transport().remoteAddress(), e.getMessage());
            return;
        }

        log.debug("CTRL {} id={} from {}", response.type(), response.id(), writer.transport().remoteAddress());
        listener.accept(response);
    }

    public void send(CtrlCommand command)
    {
        Objects.requireNonNull(command, "command");
        log.debug("CTRL send: {}", command.toWireText());
        writer.send(command.toWireText().getBytes(StandardCharsets.UTF_8));
    }
}
