package com.questrail.hlrbridge.subscriber;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class GsmSubscriptionTest
{
    @Test
    void accessorReturnsCopies()
    {
        GsmSubscription gsm = GsmSubscription.precomputed(List.of(new byte[28]));

        gsm.authTuples().get(0)[0] = 0x55;

        assertEquals(0, gsm.authTuples().get(0)[0]);
    }

    @Test
    void equalityComparesTupleContents()
    {
        byte[] tuple = new byte[28];
        tuple[27] = 7;
        GsmSubscription a = GsmSubscription.precomputed(List.of(tuple));
        GsmSubscription b = GsmSubscription.precomputed(List.of(tuple.clone()));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(new SubscriberRecord("1", a), new SubscriberRecord("1", b));
    }

    @Test
    void differentTuplesOrStateAreNotEqual()
    {
        byte[] other = new byte[28];
        other[0] = 1;

        assertNotEquals(GsmSubscription.precomputed(List.of(new byte[28])),
                GsmSubscription.precomputed(List.of(other)));
        assertNotEquals(GsmSubscription.precomputed(List.of()), GsmSubscription.none());
        assertNotEquals(GsmSubscription.precomputed(List.of(new byte[28])),
                GsmSubscription.precomputed(List.of(new byte[28], new byte[28])));
    }
}
