package com.questrail.hlrbridge.subscriber;

import java.util.Objects;

/**
 * One provisioned subscriber.
 */
public record SubscriberRecord(String imsi, GsmSubscription gsm) {
    public SubscriberRecord {
        Objects.requireNonNull(imsi, "imsi");
        Objects.requireNonNull(gsm, "gsm");
        if (imsi.isEmpty() || !imsi.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("IMSI must be decimal digits: " + imsi);
        }
    }
}
