package com.questrail.hlrbridge.protocol.ipa;

import java.util.Optional;

/**
 * Known IPA stream identifiers.
 */
public enum IpaStream
{
    /** Osmocom extension stream; payload starts with an {@link OsmoExtension} selector. */
    OSMO(0xEE),
    /** Connection management (keep-alive, identity). */
    CCM(0xFE);

    private final int id;

    IpaStream(int id)
    {
        this.id = id;
    }

    public int id()
    {
        return id;
    }

    public boolean hasExtension()
    {
        return this == OSMO;
    }

    public static Optional<IpaStream> fromId(int id)
    {
        for (IpaStream stream : values()) {
            if (stream.id == id) {
                return Optional.of(stream);
            }
        }
        return Optional.empty();
    }
}
