package com.questrail.hlrbridge.subscriber;

/**
 * Administrative state of a subscriber's GSM service.
 */
public enum GsmServiceState
{
    ACTIVE,
    INACTIVE
}
