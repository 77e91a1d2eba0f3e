package io.paywire.x402.client.challenge;

import io.paywire.x402.X402;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;

import java.util.Collections;

/** Normalises header-only challenges into a single-entry {@link PaymentRequired}. */
final class HeaderChallenges {
    static final String DEFAULT_SCHEME = "exact";

    private HeaderChallenges() {}

    /** Checks that {@code amount} is a non-negative integer of atomic units. */
    static boolean isAtomic(String amount) {
        return amount != null && amount.matches("\\d+");
    }

    static PaymentRequired single(String scheme, String network, String asset, String amount, String payTo,
                                  Integer maxTimeoutSeconds, String description) {
        PaymentRequirements r = new PaymentRequirements(
                scheme != null ? scheme : DEFAULT_SCHEME, network, asset, amount, payTo,
                maxTimeoutSeconds != null ? maxTimeoutSeconds : X402.DEFAULT_MAX_TIMEOUT_SECONDS);
        ResourceInfo resource = description != null ? new ResourceInfo(null, description, null) : null;
        return new PaymentRequired(X402.VERSION, resource, Collections.singletonList(r));
    }
}
