package io.paywire.x402;

/** Protocol constants shared by the client and server sides. */
public final class X402 {
    /** Protocol version emitted in challenges and payloads. */
    public static final int VERSION = 2;

    public static final String PAYMENT_HEADER = "X-PAYMENT";
    public static final String PAYMENT_RESPONSE_HEADER = "X-PAYMENT-RESPONSE";
    public static final String PAYMENT_REQUIRED_HEADER = "X-Payment-Required";
    public static final String WWW_AUTHENTICATE_HEADER = "WWW-Authenticate";
    public static final String PRICE_HEADER = "X-Price";
    public static final String RECIPIENT_HEADER = "X-Recipient";
    public static final String TOKEN_HEADER = "X-Token";
    public static final String CHAIN_HEADER = "X-Chain";

    /** Auth scheme token used in {@code WWW-Authenticate: x402 ...}. */
    public static final String AUTH_SCHEME = "x402";

    /** Default payment validity window. */
    public static final int DEFAULT_MAX_TIMEOUT_SECONDS = 300;

    private X402() {}
}
