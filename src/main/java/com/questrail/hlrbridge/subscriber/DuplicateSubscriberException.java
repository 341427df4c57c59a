package com.questrail.hlrbridge.subscriber;

/**
 * Raised when adding a subscriber whose IMSI is already provisioned.
 */
public final class DuplicateSubscriberException extends RuntimeException
{
    public DuplicateSubscriberException(String imsi) {
        super("Subscriber already exists: " + imsi);
    }
}
