package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of checking a payment proof, whether by a facilitator over HTTP or
 * by a scheme running in-process. Also the JSON returned by POST /verify.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {
    /** Whether the payment verification succeeded. */
    @JsonAlias("isValid")
    public boolean valid;

    /** Verification path that produced this result. */
    public VerificationMethod method;

    /** Amount actually paid, atomic units. */
    public String paidAmount;

    /** Payer address. */
    public String payer;

    /** Transaction hash, when the proof references one. */
    public String txHash;

    public Long blockNumber;

    /** Epoch millis of the payment. */
    public Long timestamp;

    /** Reason for verification failure (if valid is false). */
    @JsonAlias("invalidReason")
    public String error;

    /** Set when the proof had already been consumed. */
    public Boolean isReplay;

    /** Structured context for why verification failed. */
    public IntentTrace intentTrace;

    /** Default constructor for Jackson. */
    public VerificationResult() {}

    public static VerificationResult accepted(VerificationMethod method, String payer, String paidAmount) {
        VerificationResult r = new VerificationResult();
        r.valid = true;
        r.method = method;
        r.payer = payer;
        r.paidAmount = paidAmount;
        return r;
    }

    public static VerificationResult rejected(VerificationMethod method, String error) {
        VerificationResult r = new VerificationResult();
        r.valid = false;
        r.method = method;
        r.error = error;
        return r;
    }

    public static VerificationResult replay(String nonce) {
        VerificationResult r = rejected(VerificationMethod.CACHED,
                "Payment proof has already been used (replay): " + nonce);
        r.isReplay = true;
        return r;
    }

    @JsonIgnore
    public boolean isReplay() {
        return Boolean.TRUE.equals(isReplay);
    }
}
