package io.paywire.x402.crypto;

/**
 * Exception thrown when cryptographic signing operations fail.
 */
public class CryptoSignException extends Exception {

    public CryptoSignException(String message) {
        super(message);
    }

    public CryptoSignException(String message, Throwable cause) {
        super(message, cause);
    }
}
