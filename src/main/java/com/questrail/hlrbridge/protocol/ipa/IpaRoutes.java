package com.questrail.hlrbridge.protocol.ipa;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-connection routing table: the CCM handler and one handler per OSMO
 * extension. An extension without a handler is dropped by the multiplexer.
 */
public record IpaRoutes(
        IpaPayloadHandler ccm,
        Map<OsmoExtension, IpaPayloadHandler> osmo
) {
    public IpaRoutes {
        Objects.requireNonNull(ccm, "ccm");
        Objects.requireNonNull(osmo, "osmo");
        osmo = osmo.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(osmo));
    }

    public Optional<IpaPayloadHandler> osmo(OsmoExtension extension) {
        return Optional.ofNullable(osmo.get(extension));
    }
}
