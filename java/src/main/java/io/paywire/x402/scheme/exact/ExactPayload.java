package io.paywire.x402.scheme.exact;

import com.fasterxml.jackson.core.type.TypeReference;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.scheme.ServerScheme;
import io.paywire.x402.util.Json;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/** Scheme data of an exact payment: {@code {signature, authorization}}. */
public class ExactPayload {
    public String signature;
    public ExactAuthorization authorization;

    /** Default constructor for Jackson. */
    public ExactPayload() {}

    public ExactPayload(String signature, ExactAuthorization authorization) {
        this.signature = signature;
        this.authorization = authorization;
    }

    public Map<String, Object> toMap() {
        return Json.MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Reads and shape-checks the scheme data of a payment payload.
     *
     * @throws X402Exception with {@code INVALID_PAYLOAD}
     */
    public static ExactPayload from(Map<String, Object> payload) throws X402Exception {
        ExactPayload p;
        try {
            p = Json.MAPPER.convertValue(payload, ExactPayload.class);
        } catch (IllegalArgumentException e) {
            throw X402Exception.invalidPayload("malformed exact payload", e);
        }
        if (p == null || p.signature == null || p.signature.isBlank()) {
            throw X402Exception.invalidPayload("exact payload has no signature");
        }
        if (p.authorization == null || !p.authorization.isComplete()) {
            throw X402Exception.invalidPayload("exact payload has an incomplete authorization");
        }
        return p;
    }

    /**
     * The exact map the client signs and the facilitator verifies: the
     * authorization bound to the network and asset of the requirement.
     */
    public static Map<String, Object> signingInput(ExactAuthorization auth, PaymentRequirements requirements) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("network", requirements.network);
        m.put("asset", requirements.asset);
        m.put("from", auth.from);
        m.put("to", auth.to);
        m.put("value", auth.value);
        m.put("validAfter", auth.validAfter);
        m.put("validBefore", auth.validBefore);
        m.put("nonce", auth.nonce);
        return m;
    }

    static BigInteger atomic(String value, String field) throws X402Exception {
        try {
            BigInteger v = new BigInteger(value);
            if (v.signum() < 0) {
                throw X402Exception.invalidPayload(field + " must not be negative");
            }
            return v;
        } catch (NumberFormatException e) {
            throw X402Exception.invalidPayload(field + " is not an integer: " + value, e);
        }
    }

    static long seconds(String value, String field) throws X402Exception {
        long s;
        try {
            s = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw X402Exception.invalidPayload(field + " is not an epoch second: " + value, e);
        }
        if (s < 0 || s > ServerScheme.MAX_EPOCH_SECOND) {
            throw X402Exception.invalidPayload(field + " is out of range: " + value);
        }
        return s;
    }
}
