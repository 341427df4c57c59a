package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;
import com.questrail.hlrbridge.protocol.gsup.model.IePresence;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.questrail.hlrbridge.protocol.gsup.model.IePresence.MANDATORY;
import static com.questrail.hlrbridge.protocol.gsup.model.IePresence.OPTIONAL;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.AUTH_TUPLE;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.CAUSE;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.CN_DOMAIN;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.IMSI;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.PDP_INFO;
import static com.questrail.hlrbridge.protocol.gsup.model.InformationElementType.PDP_INFO_COMPLETE;

/**
 * GsupMessageFormat
 * -----------------------------------------------------------------------------
 * Static IE presence table per message type.
 *
 * <p>IEs not listed for a type are still accepted on decode and carried through;
 * the table only drives mandatory-presence validation.</p>
 */
public final class GsupMessageFormat
{
    private static final Map<GsupMessageType, Map<InformationElementType, IePresence>> FORMATS =
            new EnumMap<>(GsupMessageType.class);

    static {
        define(GsupMessageType.UPDATE_LOCATION_REQUEST, IMSI, MANDATORY, CN_DOMAIN, OPTIONAL);
        define(GsupMessageType.UPDATE_LOCATION_ERROR, IMSI, MANDATORY, CAUSE, MANDATORY);
        define(GsupMessageType.UPDATE_LOCATION_RESULT, IMSI, MANDATORY);
        define(GsupMessageType.SEND_AUTH_INFO_REQUEST, IMSI, MANDATORY, CN_DOMAIN, OPTIONAL);
        define(GsupMessageType.SEND_AUTH_INFO_ERROR, IMSI, MANDATORY, CAUSE, MANDATORY);
        define(GsupMessageType.SEND_AUTH_INFO_RESPONSE, IMSI, MANDATORY, AUTH_TUPLE, OPTIONAL);
        define(GsupMessageType.AUTH_FAILURE_REPORT, IMSI, MANDATORY, CN_DOMAIN, OPTIONAL);
        define(GsupMessageType.INSERT_SUBSCRIBER_DATA_REQUEST, IMSI, MANDATORY,
                CN_DOMAIN, OPTIONAL, PDP_INFO_COMPLETE, OPTIONAL, PDP_INFO, OPTIONAL);
        define(GsupMessageType.INSERT_SUBSCRIBER_DATA_ERROR, IMSI, MANDATORY, CAUSE, MANDATORY);
        define(GsupMessageType.INSERT_SUBSCRIBER_DATA_RESULT, IMSI, MANDATORY);
    }

    private GsupMessageFormat() {}

    /**
     * Returns the ordered presence map for {@code type}.
     */
    public static Map<InformationElementType, IePresence> of(GsupMessageType type)
    {
        return FORMATS.get(type);
    }

    private static void define(GsupMessageType type, Object... pairs)
    {
        Map<InformationElementType, IePresence> format = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            format.put((InformationElementType) pairs[i], (IePresence) pairs[i + 1]);
        }
        FORMATS.put(type, Collections.unmodifiableMap(format));
    }
}
