package com.questrail.hlrbridge.protocol.gsup.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * AuthVector
 * -----------------------------------------------------------------------------
 * GSM authentication triplet (RAND, SRES, Kc).
 *
 * <p>The bridge treats the triplet as opaque: it is produced by an
 * {@code AuthVectorProvider} and carried verbatim inside the AuthTuple IE.
 * Field lengths (16, 4 and 8 bytes) are <em>not</em> enforced here; the IE
 * codec rejects a malformed vector at encode time so that the failure surfaces
 * as a codec error rather than at construction.</p>
 *
 * <p>Immutability is enforced via defensive copying.</p>
 */
public final class AuthVector
{
    public static final int RAND_LENGTH = 16;
    public static final int SRES_LENGTH = 4;
    public static final int KC_LENGTH = 8;

    private final byte[] rand;
    private final byte[] sres;
    private final byte[] kc;

    public AuthVector(byte[] rand, byte[] sres, byte[] kc)
    {
        this.rand = Objects.requireNonNull(rand, "rand").clone();
        this.sres = Objects.requireNonNull(sres, "sres").clone();
        this.kc = Objects.requireNonNull(kc, "kc").clone();
    }

    public byte[] rand()
    {
        return rand.clone();
    }

    public byte[] sres()
    {
        return sres.clone();
    }

    public byte[] kc()
    {
        return kc.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof AuthVector that)) return false;
        return Arrays.equals(rand, that.rand)
                && Arrays.equals(sres, that.sres)
                && Arrays.equals(kc, that.kc);
    }

    @Override
    public int hashCode()
    {
        int result = Arrays.hashCode(rand);
        result = 31 * result + Arrays.hashCode(sres);
        result = 31 * result + Arrays.hashCode(kc);
        return result;
    }

    @Override
    public String toString()
    {
        HexFormat hex = HexFormat.of();
        return "AuthVector[rand=" + hex.formatHex(rand)
                + ", sres=" + hex.formatHex(sres)
                + ", kc=" + hex.formatHex(kc) + ']';
    }
}
