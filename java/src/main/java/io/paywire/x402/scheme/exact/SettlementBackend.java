package io.paywire.x402.scheme.exact;

import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;

import java.io.IOException;

/**
 * Submits a verified exact authorization to the chain, e.g. by calling
 * {@code transferWithAuthorization} through web3j.
 */
public interface SettlementBackend {
    /**
     * @return the settlement outcome; {@code success=false} for a rejection the chain reported
     * @throws IOException if the node cannot be reached
     * @throws InterruptedException if the call is interrupted
     */
    SettlementResult submit(ExactAuthorization authorization, String signature, PaymentRequirements requirements)
            throws IOException, InterruptedException;
}
