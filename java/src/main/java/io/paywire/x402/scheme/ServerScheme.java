package io.paywire.x402.scheme;

import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;

import java.time.Instant;

/**
 * Server role: shapes outgoing requirements and sanity-checks incoming payloads
 * before they are handed to a facilitator.
 */
public interface ServerScheme extends Scheme {

    /** Last epoch second a payload may name: 9999-12-31T23:59:59Z. */
    long MAX_EPOCH_SECOND = 253_402_300_799L;

    @Override
    default SchemeRole role() {
        return SchemeRole.SERVER;
    }

    /** Adds scheme-specific {@code extra} data to a freshly built requirement. */
    default PaymentRequirements enhance(PaymentRequirements requirements) {
        return requirements;
    }

    /**
     * Checks the payload's scheme data against the requirement it claims to satisfy.
     *
     * @throws X402Exception with {@code INVALID_PAYLOAD} when the data is incomplete or inconsistent
     */
    void validate(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception;

    /**
     * Instant after which the payload must no longer be honored.
     *
     * @throws X402Exception with {@code INVALID_PAYLOAD} when the payload carries no timing data
     */
    Instant deadline(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception;

    /**
     * Replay key for the payment proof: a transaction hash or a digest of the signature.
     *
     * @throws X402Exception with {@code INVALID_PAYLOAD} when no proof can be extracted
     */
    String proofNonce(PaymentPayload payload) throws X402Exception;

    /**
     * {@code issuedAt + windowSeconds} as an instant, for client-supplied epoch seconds.
     *
     * @throws X402Exception with {@code INVALID_PAYLOAD} when the sum leaves the supported range
     */
    static Instant expiry(long issuedAt, long windowSeconds) throws X402Exception {
        long end;
        try {
            end = Math.addExact(issuedAt, windowSeconds);
        } catch (ArithmeticException e) {
            throw X402Exception.invalidPayload("payment window overflows: " + issuedAt + " + " + windowSeconds, e);
        }
        if (end < 0 || end > MAX_EPOCH_SECOND) {
            throw X402Exception.invalidPayload("payment window ends outside the supported range: " + end);
        }
        return Instant.ofEpochSecond(end);
    }
}
