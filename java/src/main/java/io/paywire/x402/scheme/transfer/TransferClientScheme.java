package io.paywire.x402.scheme.transfer;

import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.scheme.ClientScheme;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/** Pays up front by broadcasting a transfer, then presents its hash as the proof. */
public class TransferClientScheme implements ClientScheme {
    private final TransferSubmitter submitter;
    private final Clock clock;

    public TransferClientScheme(TransferSubmitter submitter) {
        this(submitter, Clock.systemUTC());
    }

    public TransferClientScheme(TransferSubmitter submitter, Clock clock) {
        this.submitter = Objects.requireNonNull(submitter);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public String schemeId() {
        return TransferServerScheme.SCHEME;
    }

    @Override
    public Map<String, Object> createPayload(PaymentRequirements requirements, ResourceInfo resource)
            throws CryptoSignException {
        String txHash;
        try {
            txHash = submitter.transfer(requirements);
        } catch (IOException e) {
            throw new CryptoSignException("transfer submission failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CryptoSignException("transfer submission interrupted", e);
        }
        return new TransferPayload(txHash, submitter.address(), clock.instant().getEpochSecond()).toMap();
    }
}
