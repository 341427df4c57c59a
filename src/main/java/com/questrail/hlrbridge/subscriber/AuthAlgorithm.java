package com.questrail.hlrbridge.subscriber;

/**
 * How triplets are obtained for a subscriber.
 */
public enum AuthAlgorithm
{
    /** Triplets computed elsewhere and stored with the subscriber. */
    PRECOMPUTED_AUTH_TUPLES,
    COMP128V1,
    COMP128V2,
    COMP128V3
}
