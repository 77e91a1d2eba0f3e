package io.paywire.x402.scheme.exact;

import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.scheme.ServerScheme;
import io.paywire.x402.util.Hashes;

import java.time.Instant;
import java.util.LinkedHashMap;

/** Server side of the exact scheme. */
public class ExactServerScheme implements ServerScheme {
    public static final String SCHEME = "exact";

    private final String tokenName;
    private final String tokenVersion;

    public ExactServerScheme() {
        this("USDC", "2");
    }

    /** @param tokenName token domain name added to {@code extra} when the route does not set one */
    public ExactServerScheme(String tokenName, String tokenVersion) {
        this.tokenName = tokenName;
        this.tokenVersion = tokenVersion;
    }

    @Override
    public String schemeId() {
        return SCHEME;
    }

    @Override
    public PaymentRequirements enhance(PaymentRequirements requirements) {
        PaymentRequirements r = requirements.copy();
        if (r.extra == null) {
            r.extra = new LinkedHashMap<>();
        }
        r.extra.putIfAbsent("name", tokenName);
        r.extra.putIfAbsent("version", tokenVersion);
        return r;
    }

    @Override
    public void validate(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception {
        ExactAuthorization auth = ExactPayload.from(payload.payload).authorization;
        if (!auth.to.equalsIgnoreCase(requirements.payTo)) {
            throw X402Exception.invalidPayload("authorization pays " + auth.to + ", expected " + requirements.payTo);
        }
        if (ExactPayload.atomic(auth.value, "value").compareTo(ExactPayload.atomic(requirements.amount, "amount")) < 0) {
            throw X402Exception.invalidPayload("authorized value " + auth.value + " is below " + requirements.amount);
        }
    }

    @Override
    public Instant deadline(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception {
        ExactAuthorization auth = ExactPayload.from(payload.payload).authorization;
        long issued = ExactPayload.seconds(auth.validAfter, "validAfter");
        long validBefore = ExactPayload.seconds(auth.validBefore, "validBefore");
        Instant byTimeout = ServerScheme.expiry(issued, requirements.maxTimeoutSeconds);
        return Instant.ofEpochSecond(Math.min(validBefore, byTimeout.getEpochSecond()));
    }

    @Override
    public String proofNonce(PaymentPayload payload) throws X402Exception {
        return Hashes.sha256Hex(ExactPayload.from(payload.payload).signature.toLowerCase());
    }
}
