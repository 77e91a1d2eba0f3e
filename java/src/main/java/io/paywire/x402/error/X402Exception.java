package io.paywire.x402.error;

/**
 * Typed payment failure. Thrown inside the negotiation pipeline and converted
 * into a result object at the server and client boundaries.
 */
public class X402Exception extends Exception {
    private final ErrorKind kind;

    public X402Exception(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public X402Exception(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static X402Exception invalidPayload(String message) {
        return new X402Exception(ErrorKind.INVALID_PAYLOAD, message);
    }

    public static X402Exception invalidPayload(String message, Throwable cause) {
        return new X402Exception(ErrorKind.INVALID_PAYLOAD, message, cause);
    }

    public static X402Exception requirementMismatch(String message) {
        return new X402Exception(ErrorKind.REQUIREMENT_MISMATCH, message);
    }

    public static X402Exception deadlineExpired(String message) {
        return new X402Exception(ErrorKind.DEADLINE_EXPIRED, message);
    }

    public static X402Exception noMatchingScheme(String message) {
        return new X402Exception(ErrorKind.NO_MATCHING_SCHEME, message);
    }

    public static X402Exception verificationFailed(String message) {
        return new X402Exception(ErrorKind.VERIFICATION_FAILED, message);
    }

    public static X402Exception replayDetected(String message) {
        return new X402Exception(ErrorKind.REPLAY_DETECTED, message);
    }

    public static X402Exception settlementFailed(String message) {
        return new X402Exception(ErrorKind.SETTLEMENT_FAILED, message);
    }

    public static X402Exception facilitatorUnreachable(String message, Throwable cause) {
        return new X402Exception(ErrorKind.FACILITATOR_UNREACHABLE, message, cause);
    }
}
