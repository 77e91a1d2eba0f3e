package io.paywire.x402.server;

import io.paywire.x402.error.X402Exception;
import io.paywire.x402.facilitator.FacilitatorClient;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.nonce.NonceStore;
import io.paywire.x402.scheme.ServerScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Verifies and settles a payment that already passed shape and deadline
 * checks. A proof is spent as soon as verification succeeds: from then on
 * its nonce stays consumed whatever settlement does, unless the thread is
 * interrupted before settlement was attempted.
 */
public class PaymentProcessor {
    private static final Logger log = LoggerFactory.getLogger(PaymentProcessor.class);

    private final FacilitatorClient facilitator;
    private final NonceStore nonces;
    private final Duration nonceTtl;

    public PaymentProcessor(FacilitatorClient facilitator, NonceStore nonces, Duration nonceTtl) {
        this.facilitator = Objects.requireNonNull(facilitator);
        this.nonces = Objects.requireNonNull(nonces);
        this.nonceTtl = Objects.requireNonNull(nonceTtl);
    }

    /**
     * @return a {@link ProcessResult.Type#PAID} result
     * @throws X402Exception with the failure kind; {@code REPLAY_DETECTED} for a spent proof
     * @throws InterruptedException if interrupted while talking to the facilitator
     */
    public ProcessResult process(PaymentPayload payload, PaymentRequirements requirements, ServerScheme scheme)
            throws X402Exception, InterruptedException {
        String nonce = scheme.proofNonce(payload);
        if (nonces.has(nonce)) {
            throw X402Exception.replayDetected("payment proof already used: " + nonce);
        }

        VerificationResult verification;
        try {
            verification = facilitator.verify(payload, requirements);
        } catch (IOException e) {
            log.error("x402 facilitator verify failed for {} on {}", requirements.scheme, requirements.network, e);
            throw X402Exception.facilitatorUnreachable("payment verification unavailable: " + e.getMessage(), e);
        }
        if (verification == null || !verification.valid) {
            String reason = verification != null && verification.error != null
                    ? verification.error : "payment verification failed";
            if (verification != null && verification.isReplay()) {
                throw X402Exception.replayDetected(reason);
            }
            throw X402Exception.verificationFailed(reason);
        }

        Duration ttl = nonceTtl.compareTo(Duration.ofSeconds(requirements.maxTimeoutSeconds)) >= 0
                ? nonceTtl : Duration.ofSeconds(requirements.maxTimeoutSeconds);
        if (!nonces.add(nonce, ttl)) {
            throw X402Exception.replayDetected("payment proof already used: " + nonce);
        }

        if (Thread.currentThread().isInterrupted()) {
            nonces.release(nonce);
            throw new InterruptedException("interrupted before settlement");
        }

        SettlementResult settlement;
        try {
            settlement = facilitator.settle(payload, requirements);
        } catch (IOException e) {
            log.error("x402 facilitator settle failed for nonce {}", nonce, e);
            throw X402Exception.facilitatorUnreachable("payment settlement unavailable: " + e.getMessage(), e);
        }
        if (settlement == null || !settlement.success) {
            String reason = settlement != null && settlement.error != null ? settlement.error : "settlement failed";
            log.error("x402 settlement failed for nonce {}: {}", nonce, reason);
            throw X402Exception.settlementFailed(reason);
        }

        if (settlement.payer == null) {
            settlement.payer = verification.payer;
        }
        if (settlement.network == null) {
            settlement.network = requirements.network;
        }
        log.info("x402 payment settled: {} {} on {} tx={} payer={}", requirements.amount, requirements.asset,
                requirements.network, settlement.transaction, settlement.payer);
        return ProcessResult.paid(payload, requirements, verification, settlement);
    }
}
