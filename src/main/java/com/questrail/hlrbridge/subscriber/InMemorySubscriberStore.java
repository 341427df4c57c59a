package com.questrail.hlrbridge.subscriber;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed {@link SubscriberStore} for wiring and tests.
 */
public final class InMemorySubscriberStore implements SubscriberStore
{
    private final Map<String, SubscriberRecord> subscribers = new LinkedHashMap<>();

    @Override
    public synchronized Optional<SubscriberRecord> get(String imsi)
    {
        return Optional.ofNullable(subscribers.get(imsi));
    }

    @Override
    public synchronized void add(SubscriberRecord subscriber)
    {
        Objects.requireNonNull(subscriber, "subscriber");
        if (subscribers.putIfAbsent(subscriber.imsi(), subscriber) != null) {
            throw new DuplicateSubscriberException(subscriber.imsi());
        }
    }

    @Override
    public synchronized boolean delete(String imsi)
    {
        return subscribers.remove(imsi) != null;
    }

    @Override
    public synchronized List<SubscriberRecord> list()
    {
        return List.copyOf(subscribers.values());
    }
}
