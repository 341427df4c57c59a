package com.questrail.hlrbridge.protocol.ipa;

/**
 * Consumer of the payloads routed to one stream (or one OSMO extension).
 *
 * <p>Handlers are invoked on the connection's serialized callback thread. An
 * exception thrown here is reported by the multiplexer and does not affect
 * later frames.</p>
 */
@FunctionalInterface
public interface IpaPayloadHandler
{
    /**
     * @param payload frame payload, without header or extension byte; owned by
     *                the handler
     */
    void onPayload(byte[] payload);
}
