package io.paywire.x402.scheme.exact;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * ERC-3009 style transfer authorization carried inside an exact-scheme payload.
 * Timestamps are epoch seconds, amounts atomic units, all as decimal strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExactAuthorization {
    /** Wallet address of the person making the payment (sender). */
    public String from;

    /** Wallet address receiving the payment. */
    public String to;

    /** Payment amount in atomic units. */
    public String value;

    /** Timestamp after which the authorization is valid. */
    public String validAfter;

    /** Timestamp before which the authorization is valid. */
    public String validBefore;

    /** Unique hex-encoded nonce to prevent replay attacks. */
    public String nonce;

    /** Default constructor for Jackson. */
    public ExactAuthorization() {}

    boolean isComplete() {
        return notBlank(from) && notBlank(to) && notBlank(value)
                && notBlank(validAfter) && notBlank(validBefore) && notBlank(nonce);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
