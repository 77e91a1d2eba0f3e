package io.paywire.x402.facilitator;

import io.paywire.x402.X402;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;

/** Body of POST /verify and POST /settle. */
public class FacilitatorRequest {
    public int x402Version;
    public PaymentPayload paymentPayload;
    public PaymentRequirements paymentRequirements;

    /** Default constructor for Jackson. */
    public FacilitatorRequest() {}

    public FacilitatorRequest(PaymentPayload paymentPayload, PaymentRequirements paymentRequirements) {
        this.x402Version = paymentPayload != null && paymentPayload.x402Version > 0
                ? paymentPayload.x402Version : X402.VERSION;
        this.paymentPayload = paymentPayload;
        this.paymentRequirements = paymentRequirements;
    }
}
