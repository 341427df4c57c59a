package com.questrail.hlrbridge.protocol.ipa;

import java.util.Optional;

/**
 * Extension selectors carried as the first payload byte on the
 * {@link IpaStream#OSMO} stream.
 */
public enum OsmoExtension
{
    CTRL(0x00),
    GSUP(0x05),
    OAP(0x06);

    private final int selector;

    OsmoExtension(int selector)
    {
        this.selector = selector;
    }

    public int selector()
    {
        return selector;
    }

    public static Optional<OsmoExtension> fromSelector(int selector)
    {
        for (OsmoExtension ext : values()) {
            if (ext.selector == selector) {
                return Optional.of(ext);
            }
        }
        return Optional.empty();
    }
}
