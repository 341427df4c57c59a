package com.questrail.hlrbridge.protocol.ctrl;

/**
 * The response id does not match the request id.
 */
public final class CtrlMessageIdException extends CtrlException
{
    public CtrlMessageIdException(int requestId, int responseId) {
        super("Response id " + responseId + " does not match request id " + requestId);
    }
}
