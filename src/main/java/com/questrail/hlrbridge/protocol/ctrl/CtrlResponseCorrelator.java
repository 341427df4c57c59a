package com.questrail.hlrbridge.protocol.ctrl;

/**
 * Checks a response against the request it is supposed to answer.
 */
public final class CtrlResponseCorrelator
{
    private final int requestId;

    public CtrlResponseCorrelator(int requestId)
    {
        this.requestId = requestId;
    }

    /**
     * @return {@code response} if it answers the request successfully
     * @throws CtrlMessageIdException      on an id mismatch
     * @throws CtrlErrorResponseException  on an ERROR response with the right id
     */
    public CtrlResponse accept(CtrlResponse response) throws CtrlException
    {
        if (response.id() != requestId) {
            throw new CtrlMessageIdException(requestId, response.id());
        }
        if (response.isError()) {
            throw new CtrlErrorResponseException(requestId, response.error());
        }
        return response;
    }
}
