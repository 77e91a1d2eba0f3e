package io.paywire.x402.scheme.transfer;

import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.scheme.ServerScheme;

import java.time.Instant;

/** Server side of the pre-paid transfer scheme. The tx hash itself is the replay key. */
public class TransferServerScheme implements ServerScheme {
    public static final String SCHEME = "transfer";

    @Override
    public String schemeId() {
        return SCHEME;
    }

    @Override
    public void validate(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception {
        TransferPayload.from(payload.payload);
    }

    @Override
    public Instant deadline(PaymentPayload payload, PaymentRequirements requirements) throws X402Exception {
        return ServerScheme.expiry(TransferPayload.from(payload.payload).submittedAt, requirements.maxTimeoutSeconds);
    }

    @Override
    public String proofNonce(PaymentPayload payload) throws X402Exception {
        return TransferPayload.from(payload.payload).txHash.toLowerCase();
    }
}
