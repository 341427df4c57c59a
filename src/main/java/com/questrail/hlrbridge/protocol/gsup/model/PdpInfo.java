package com.questrail.hlrbridge.protocol.gsup.model;

/**
 * PDP-Info values announced to the peer.
 *
 * <p>Only one structure is ever sent: a single PDP context allowing any APN.
 * Its nested IEs are context id 1, PDP type IPv4 (0x0121) and APN "*".</p>
 */
public final class PdpInfo
{
    private static final byte[] WILDCARD_APN = {
            0x10, 0x01, 0x01,
            0x11, 0x02, 0x01, 0x21,
            0x12, 0x02, 0x01, 0x2A
    };

    private PdpInfo() {}

    public static byte[] wildcardApn()
    {
        return WILDCARD_APN.clone();
    }
}
