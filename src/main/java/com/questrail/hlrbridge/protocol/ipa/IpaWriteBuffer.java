package com.questrail.hlrbridge.protocol.ipa;

/**
 * Buffer handed out by {@link IpaWriter#allocate(int)}: header already
 * written, payload to be filled in from {@code payloadOffset}.
 */
public record IpaWriteBuffer(byte[] buffer, int payloadOffset) {
}
