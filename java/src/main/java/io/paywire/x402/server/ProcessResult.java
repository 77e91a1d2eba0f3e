package io.paywire.x402.server;

import io.paywire.x402.X402;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a resource server decided about one request. Adapters copy
 * {@link #status()}, {@link #headers()} and {@link #body()} onto the response
 * unless the result is {@link Type#PAID} or {@link Type#NO_PAYMENT_REQUIRED},
 * in which case the request proceeds to the resource.
 */
public class ProcessResult {

    public enum Type {
        NO_PAYMENT_REQUIRED,
        PAYMENT_REQUIRED,
        PAYMENT_ERROR,
        PAID
    }

    private final Type type;
    private final int status;
    private final Object body;
    private final Map<String, String> headers;
    private final ErrorKind error;
    private final PaymentPayload payload;
    private final PaymentRequirements requirements;
    private final VerificationResult verification;
    private final SettlementResult settlement;

    private ProcessResult(Type type, int status, Object body, Map<String, String> headers, ErrorKind error,
                          PaymentPayload payload, PaymentRequirements requirements,
                          VerificationResult verification, SettlementResult settlement) {
        this.type = type;
        this.status = status;
        this.body = body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.error = error;
        this.payload = payload;
        this.requirements = requirements;
        this.verification = verification;
        this.settlement = settlement;
    }

    public static ProcessResult noPaymentRequired() {
        return new ProcessResult(Type.NO_PAYMENT_REQUIRED, 200, null, Collections.emptyMap(),
                null, null, null, null, null);
    }

    /** A 402 challenge; {@code error} is null for the first challenge of a request. */
    public static ProcessResult paymentRequired(PaymentRequired challenge, Map<String, String> headers,
                                                ErrorKind error, VerificationResult verification) {
        return new ProcessResult(Type.PAYMENT_REQUIRED, 402, challenge, headers, error,
                null, null, verification, null);
    }

    public static ProcessResult paymentError(ErrorKind error, String message) {
        return new ProcessResult(Type.PAYMENT_ERROR, error.httpStatus(), PaymentError.of(error, message),
                Collections.emptyMap(), error, null, null, null, null);
    }

    public static ProcessResult paid(PaymentPayload payload, PaymentRequirements requirements,
                                     VerificationResult verification, SettlementResult settlement) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(X402.PAYMENT_RESPONSE_HEADER, settlement.toHeader());
        headers.put("Access-Control-Expose-Headers", X402.PAYMENT_RESPONSE_HEADER);
        return new ProcessResult(Type.PAID, 200, null, headers, null,
                payload, requirements, verification, settlement);
    }

    public Type type() {
        return type;
    }

    /** True if the request may proceed to the protected resource. */
    public boolean allowed() {
        return type == Type.PAID || type == Type.NO_PAYMENT_REQUIRED;
    }

    public int status() {
        return status;
    }

    /** {@link PaymentRequired}, {@link PaymentError}, or null. */
    public Object body() {
        return body;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public ErrorKind error() {
        return error;
    }

    public PaymentPayload payload() {
        return payload;
    }

    public PaymentRequirements requirements() {
        return requirements;
    }

    public VerificationResult verification() {
        return verification;
    }

    public SettlementResult settlement() {
        return settlement;
    }

    /** The challenge body, for {@link Type#PAYMENT_REQUIRED} results. */
    public PaymentRequired challenge() {
        return body instanceof PaymentRequired ? (PaymentRequired) body : null;
    }
}
