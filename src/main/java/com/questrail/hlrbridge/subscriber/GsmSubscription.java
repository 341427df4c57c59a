package com.questrail.hlrbridge.subscriber;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * GSM service data of one subscriber.
 *
 * @param state      administrative state
 * @param algorithm  how triplets are obtained
 * @param authTuples stored triplets, each 28 bytes: RAND(16) SRES(4) Kc(8)
 */
public record GsmSubscription(
        GsmServiceState state,
        AuthAlgorithm algorithm,
        List<byte[]> authTuples
) {
    public static final int AUTH_TUPLE_LENGTH = 28;

    public GsmSubscription {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(authTuples, "authTuples");
        authTuples = authTuples.stream().map(byte[]::clone).toList();
        for (byte[] tuple : authTuples) {
            if (tuple.length != AUTH_TUPLE_LENGTH) {
                throw new IllegalArgumentException(
                        "Auth tuple must be " + AUTH_TUPLE_LENGTH + " bytes, got " + tuple.length);
            }
        }
    }

    /**
     * Copies of the stored triplets; changing them leaves this subscription intact.
     */
    @Override
    public List<byte[]> authTuples() {
        return authTuples.stream().map(byte[]::clone).toList();
    }

    /**
     * Compares triplets by content.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GsmSubscription other)) {
            return false;
        }
        if (state != other.state || algorithm != other.algorithm
                || authTuples.size() != other.authTuples.size()) {
            return false;
        }
        for (int i = 0; i < authTuples.size(); i++) {
            if (!Arrays.equals(authTuples.get(i), other.authTuples.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(state, algorithm);
        for (byte[] tuple : authTuples) {
            h = 31 * h + Arrays.hashCode(tuple);
        }
        return h;
    }

    @Override
    public String toString() {
        return "GsmSubscription[state=" + state + ", algorithm=" + algorithm
                + ", authTuples=" + authTuples.size() + "]";
    }

    /**
     * Subscription with GSM service disabled and no stored triplets.
     */
    public static GsmSubscription none() {
        return new GsmSubscription(GsmServiceState.INACTIVE, AuthAlgorithm.PRECOMPUTED_AUTH_TUPLES, List.of());
    }

    public static GsmSubscription precomputed(List<byte[]> authTuples) {
        return new GsmSubscription(GsmServiceState.ACTIVE, AuthAlgorithm.PRECOMPUTED_AUTH_TUPLES, authTuples);
    }
}
