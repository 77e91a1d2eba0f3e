package io.paywire.x402.scheme;

import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;

import java.io.IOException;

/** Facilitator role: verifies a payload cryptographically or on-chain and settles it. */
public interface FacilitatorScheme extends Scheme {

    @Override
    default SchemeRole role() {
        return SchemeRole.FACILITATOR;
    }

    /**
     * @throws IOException if the chain or signing backend cannot be reached
     * @throws InterruptedException if the call is interrupted
     */
    VerificationResult verify(PaymentPayload payload, PaymentRequirements requirements)
            throws IOException, InterruptedException;

    /**
     * Executes the payment. Only called after a successful {@link #verify}.
     *
     * @throws IOException if the settlement backend cannot be reached
     * @throws InterruptedException if the call is interrupted
     */
    SettlementResult settle(PaymentPayload payload, PaymentRequirements requirements)
            throws IOException, InterruptedException;
}
