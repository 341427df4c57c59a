package com.questrail.hlrbridge.protocol.gsup.model;

/**
 * Whether an IE must or may appear in a given message type.
 */
public enum IePresence
{
    MANDATORY,
    OPTIONAL
}
