package com.questrail.hlrbridge.protocol.ctrl;

/**
 * Base class for CTRL exchange failures.
 */
public class CtrlException extends Exception
{
    public CtrlException(String message) {
        super(message);
    }
}
