package com.questrail.hlrbridge.protocol.ctrl;

/**
 * The peer answered with an {@code ERROR} response.
 */
public final class CtrlErrorResponseException extends CtrlException
{
    private final String error;

    public CtrlErrorResponseException(int requestId, String error) {
        super("Request id " + requestId + " returned error response: " + error);
        this.error = error;
    }

    public String error() {
        return error;
    }
}
