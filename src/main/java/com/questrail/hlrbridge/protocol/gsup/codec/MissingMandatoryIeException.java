package com.questrail.hlrbridge.protocol.gsup.codec;

import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;
import com.questrail.hlrbridge.protocol.gsup.model.InformationElementType;

/**
 * A message lacks an IE that its type requires.
 *
 * <p>Thrown by decode after the IE walk, and by encode before any byte is
 * written.</p>
 */
public final class MissingMandatoryIeException extends GsupCodecException
{
    private final GsupMessageType messageType;
    private final InformationElementType ieType;

    public MissingMandatoryIeException(GsupMessageType messageType, InformationElementType ieType) {
        super(Kind.MISSING_MANDATORY_IE, "Missing mandatory IE " + ieType + " in " + messageType);
        this.messageType = messageType;
        this.ieType = ieType;
    }

    public GsupMessageType messageType() {
        return messageType;
    }

    public InformationElementType ieType() {
        return ieType;
    }
}
