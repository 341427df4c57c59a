package com.questrail.hlrbridge.protocol.ipa.codec;

import com.questrail.hlrbridge.protocol.ipa.IpaFrame;

/**
 * IpaFrameDecoder
 * -----------------------------------------------------------------------------
 * Stream reassembler for IPA framing.
 *
 * <p>This interface defines the inbound boundary between raw TCP chunks and
 * {@link IpaFrame} instances. Unlike a datagram decoder it is stateful: chunks
 * may split or coalesce frames arbitrarily, so bytes are accumulated across
 * calls until a complete frame is available.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading the {@code length:u16be, stream:u8} header</li>
 *   <li>Waiting until the declared payload is buffered</li>
 *   <li>Splitting off the OSMO extension selector</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for routing frames or
 * interpreting payloads. One instance serves exactly one connection.</p>
 */
public interface IpaFrameDecoder
{
    /**
     * Receives frames as they complete.
     */
    interface Sink
    {
        void onFrame(IpaFrame frame);

        /**
         * A complete frame whose structure is unusable (an OSMO frame without
         * its extension byte). The bytes have already been consumed.
         */
        void onMalformedFrame(int streamId, String reason);
    }

    /**
     * Append {@code chunk} and deliver every frame that is now complete, in
     * arrival order.
     *
     * <p>The read position advances past a frame <em>before</em> the sink is
     * called, so a sink that throws never causes a frame to be delivered
     * twice. The exception propagates to the caller and any frames still
     * buffered are delivered on the next call.</p>
     */
    void decode(byte[] chunk, Sink sink);

    /**
     * Number of bytes received but not yet consumed as part of a frame.
     */
    int bufferedBytes();

    /**
     * Discard all buffered bytes (connection lost).
     */
    void reset();
}
