package com.questrail.hlrbridge.subscriber;

import java.util.List;
import java.util.Optional;

/**
 * Subscriber data backing the reference auth-vector provider.
 *
 * <p>Implementations must be safe for concurrent use: connections are served
 * from several event loop threads.</p>
 */
public interface SubscriberStore
{
    Optional<SubscriberRecord> get(String imsi);

    /**
     * @throws DuplicateSubscriberException if the IMSI already exists
     */
    void add(SubscriberRecord subscriber);

    /**
     * @return {@code true} if a subscriber was removed
     */
    boolean delete(String imsi);

    /**
     * Snapshot of all subscribers in insertion order.
     */
    List<SubscriberRecord> list();
}
