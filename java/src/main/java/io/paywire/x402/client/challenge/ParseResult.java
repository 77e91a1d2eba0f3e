package io.paywire.x402.client.challenge;

import io.paywire.x402.model.PaymentRequired;

/** Either a parsed challenge or the reason a strategy could not read one. */
public final class ParseResult {
    private final PaymentRequired challenge;
    private final String source;
    private final String failure;

    private ParseResult(PaymentRequired challenge, String source, String failure) {
        this.challenge = challenge;
        this.source = source;
        this.failure = failure;
    }

    public static ParseResult success(PaymentRequired challenge, String source) {
        return new ParseResult(challenge, source, null);
    }

    public static ParseResult failure(String reason) {
        return new ParseResult(null, null, reason);
    }

    public boolean isSuccess() {
        return challenge != null;
    }

    public PaymentRequired challenge() {
        return challenge;
    }

    /** Name of the strategy that produced the challenge. */
    public String source() {
        return source;
    }

    public String failure() {
        return failure;
    }
}
