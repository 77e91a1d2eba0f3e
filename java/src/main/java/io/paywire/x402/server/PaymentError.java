package io.paywire.x402.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.model.IntentTrace;
import io.paywire.x402.model.Remediation;

/** Body of a non-402 payment failure (400 or 502). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentError {
    /** Wire code of the failure, e.g. {@code invalid_payload}. */
    public String error;
    public String message;
    public IntentTrace intentTrace;

    public PaymentError() {}

    public static PaymentError of(ErrorKind kind, String message) {
        PaymentError e = new PaymentError();
        e.error = kind.code();
        e.message = message;
        e.intentTrace = new IntentTrace(kind.code(), message, remediation(kind));
        return e;
    }

    private static Remediation remediation(ErrorKind kind) {
        switch (kind) {
            case FACILITATOR_UNREACHABLE:
                return new Remediation(Remediation.RETRY_LATER, "payment facilitator is unavailable");
            case INVALID_PAYLOAD:
            case REQUIREMENT_MISMATCH:
                return new Remediation(Remediation.SIGN_NEW_PAYMENT, "sign a payment for one of the offered requirements");
            default:
                return null;
        }
    }
}
