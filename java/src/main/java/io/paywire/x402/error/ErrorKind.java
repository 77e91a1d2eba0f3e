package io.paywire.x402.error;

import java.util.Optional;

/** Failure kinds of a payment negotiation, with their wire code and HTTP status. */
public enum ErrorKind {
    INVALID_PAYLOAD("invalid_payload", 400),
    REQUIREMENT_MISMATCH("requirement_mismatch", 400),
    DEADLINE_EXPIRED("deadline_expired", 402),
    NO_MATCHING_SCHEME("no_matching_scheme", 402),
    VERIFICATION_FAILED("verification_failed", 402),
    REPLAY_DETECTED("replay_detected", 402),
    SETTLEMENT_FAILED("settlement_failed", 402),
    FACILITATOR_UNREACHABLE("facilitator_unreachable", 502),
    PAYMENT_REJECTED("payment_rejected", 402);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    /** Status a resource server answers with when it fails a request for this reason. */
    public int httpStatus() {
        return httpStatus;
    }

    /** True when the server should answer with a fresh challenge rather than a bare error. */
    public boolean renewsChallenge() {
        return httpStatus == 402;
    }

    /** Kind with the given wire code, if any. */
    public static Optional<ErrorKind> fromCode(String code) {
        for (ErrorKind k : values()) {
            if (k.code.equals(code)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
