package com.questrail.hlrbridge.auth;

/**
 * An authentication triplet could not be produced for a known subscriber.
 */
public class CryptoException extends Exception
{
    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
