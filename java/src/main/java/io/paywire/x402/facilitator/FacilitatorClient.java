package io.paywire.x402.facilitator;

import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;

import java.io.IOException;
import java.util.Set;

/** Contract for calling an x402 facilitator (HTTP, in-process, mock, etc.). */
public interface FacilitatorClient {
    /**
     * Verifies a payment payload against the given requirements.
     *
     * @param paymentPayload the payment payload to verify
     * @param req the payment requirements to validate against
     * @return verification result indicating if payment is valid
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    VerificationResult verify(PaymentPayload paymentPayload,
                              PaymentRequirements req)
            throws IOException, InterruptedException;

    /**
     * Settles a verified payment.
     *
     * @param paymentPayload the payment payload to settle
     * @param req the payment requirements for settlement
     * @return settlement result with transaction details if successful
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    SettlementResult settle(PaymentPayload paymentPayload,
                            PaymentRequirements req)
            throws IOException, InterruptedException;

    /**
     * Retrieves the set of payment kinds supported by this facilitator.
     *
     * @return set of supported payment kinds (scheme/network combinations)
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    Set<Kind> supported() throws IOException, InterruptedException;
}
