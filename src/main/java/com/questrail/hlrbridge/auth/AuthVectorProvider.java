package com.questrail.hlrbridge.auth;

import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;

/**
 * Source of GSM authentication triplets for a subscriber.
 *
 * <p>Implementations may consult a database, an HSM or a remote service.
 * They are called on the connection's callback thread and should not block for
 * long.</p>
 */
public interface AuthVectorProvider
{
    /**
     * @param imsi subscriber identity, decimal digits
     * @return a fresh (or stored) triplet for the subscriber
     * @throws SubscriberNotFoundException if the IMSI is not provisioned
     * @throws CryptoException             if no triplet can be produced
     */
    AuthVector getAuthVector(String imsi) throws CryptoException, SubscriberNotFoundException;
}
