package com.questrail.hlrbridge.protocol.ipa;

import com.questrail.hlrbridge.transport.StreamTransport;

/**
 * Builds the handlers for a newly connected peer.
 *
 * <p>Handlers typically capture an {@link IpaWriter} bound to {@code transport}
 * so that replies go back on the same connection.</p>
 */
@FunctionalInterface
public interface IpaRoutesFactory
{
    IpaRoutes create(StreamTransport transport);
}
