package com.questrail.hlrbridge.auth;

/**
 * The requested IMSI is not provisioned.
 */
public class SubscriberNotFoundException extends Exception
{
    private final String imsi;

    public SubscriberNotFoundException(String imsi) {
        super("Subscriber not found: " + imsi);
        this.imsi = imsi;
    }

    public String imsi() {
        return imsi;
    }
}
