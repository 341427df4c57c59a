package com.questrail.hlrbridge.protocol.gsup.codec.impl;

import java.util.Objects;
import java.util.function.Function;

/**
 * Length bounds and value routines for one top-level IE type.
 *
 * @param minLength inclusive lower bound on the encoded value length
 * @param maxLength inclusive upper bound on the encoded value length
 * @param decoder   value bytes to Java value; only called within bounds
 * @param encoder   Java value to value bytes; result is bounds-checked by the caller
 */
record InformationElementSpec(
        int minLength,
        int maxLength,
        Function<byte[], Object> decoder,
        Function<Object, byte[]> encoder
) {
    InformationElementSpec {
        if (minLength < 0 || maxLength > 0xFF || minLength > maxLength) {
            throw new IllegalArgumentException("Invalid bounds " + minLength + ".." + maxLength);
        }
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");
    }

    boolean accepts(int length) {
        return length >= minLength && length <= maxLength;
    }
}
