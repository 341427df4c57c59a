package com.questrail.hlrbridge.protocol.ipa.ccm;

import com.questrail.hlrbridge.protocol.ipa.IpaPayloadHandler;
import com.questrail.hlrbridge.protocol.ipa.IpaWriter;
import com.questrail.hlrbridge.protocol.ipa.codec.IpaFramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Handles the CCM (management) stream: answers ping with pong.
 *
 * <p>Identity exchange and other CCM messages are logged and ignored.</p>
 */
public final class CcmKeepAliveHandler implements IpaPayloadHandler
{
    private static final Logger log = LoggerFactory.getLogger(CcmKeepAliveHandler.class);

    public static final int PING = 0x00;
    public static final int PONG = 0x01;

    private static final byte[] PONG_PAYLOAD = { (byte) PONG };

    private final IpaWriter writer;

    public CcmKeepAliveHandler(IpaWriter writer)
    {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void onPayload(byte[] payload)
    {
        if (payload.length == 0) {
            throw new IpaFramingException("Empty CCM payload");
        }

        int type = payload[0] & 0xFF;
        if (type == PING) {
            log.trace("CCM ping from {}", writer.transport().remoteAddress());
            writer.send(PONG_PAYLOAD);
        }
        else {
            log.debug("Ignoring CCM message 0x{} from {}",
                    Integer.toHexString(type), writer.transport().remoteAddress());
        }
    }
}
