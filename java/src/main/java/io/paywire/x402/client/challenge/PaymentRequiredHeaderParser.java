package io.paywire.x402.client.challenge;

import io.paywire.x402.X402;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.util.Json;

import java.net.http.HttpHeaders;
import java.util.Optional;

/** {@code X-Payment-Required} carrying the challenge as raw or base64 JSON. */
public class PaymentRequiredHeaderParser implements ChallengeParserStrategy {

    @Override
    public String name() {
        return "x-payment-required";
    }

    @Override
    public ParseResult parse(HttpHeaders headers, String body) {
        Optional<String> value = headers.firstValue(X402.PAYMENT_REQUIRED_HEADER);
        if (value.isEmpty() || value.get().isBlank()) {
            return ParseResult.failure("no " + X402.PAYMENT_REQUIRED_HEADER + " header");
        }
        PaymentRequired pr;
        try {
            pr = Json.fromBase64OrJson(value.get(), PaymentRequired.class);
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(e.getMessage());
        }
        if (!pr.isWellFormed()) {
            return ParseResult.failure("header has no x402Version or accepts");
        }
        return ParseResult.success(pr, name());
    }
}
