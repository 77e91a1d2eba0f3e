package io.paywire.x402.scheme.transfer;

import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.SettlementStatus;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.scheme.FacilitatorScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Inspects the referenced transaction through chain RPC: it must be mined,
 * successful, sufficiently confirmed, and move at least {@code amount} of
 * {@code asset} to {@code payTo}. An optional tolerance accepts transfers
 * short of {@code amount} by up to that percentage, rounded in the payee's favour.
 */
public class TransferFacilitatorScheme implements FacilitatorScheme {
    private static final Logger log = LoggerFactory.getLogger(TransferFacilitatorScheme.class);

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final ChainReader chain;
    private final int requiredConfirmations;
    private final int amountTolerancePercent;
    private final Clock clock;

    public TransferFacilitatorScheme(ChainReader chain, int requiredConfirmations) {
        this(chain, requiredConfirmations, 0, Clock.systemUTC());
    }

    public TransferFacilitatorScheme(ChainReader chain, int requiredConfirmations, Clock clock) {
        this(chain, requiredConfirmations, 0, clock);
    }

    /** @throws IllegalArgumentException if the tolerance is outside 0..100 */
    public TransferFacilitatorScheme(ChainReader chain, int requiredConfirmations, int amountTolerancePercent,
                                     Clock clock) {
        if (amountTolerancePercent < 0 || amountTolerancePercent > 100) {
            throw new IllegalArgumentException("amount tolerance must be 0..100 percent: " + amountTolerancePercent);
        }
        this.chain = Objects.requireNonNull(chain);
        this.requiredConfirmations = requiredConfirmations;
        this.amountTolerancePercent = amountTolerancePercent;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public String schemeId() {
        return TransferServerScheme.SCHEME;
    }

    @Override
    public VerificationResult verify(PaymentPayload payload, PaymentRequirements requirements)
            throws IOException, InterruptedException {
        TransferPayload transfer;
        try {
            transfer = TransferPayload.from(payload.payload);
        } catch (X402Exception e) {
            return VerificationResult.rejected(VerificationMethod.ON_CHAIN, e.getMessage());
        }

        Optional<TransferReceipt> found = chain.receipt(requirements.network, transfer.txHash);
        if (found.isEmpty()) {
            return withTx(VerificationResult.rejected(VerificationMethod.ON_CHAIN, "Transaction not found"), transfer.txHash);
        }
        TransferReceipt receipt = found.get();
        if (!receipt.isSuccess()) {
            return withBlock(VerificationResult.rejected(VerificationMethod.ON_CHAIN, "Transaction failed or reverted"), receipt);
        }

        long confirmations = chain.latestBlock(requirements.network) - receipt.getBlockNumber();
        if (confirmations < requiredConfirmations) {
            return withBlock(VerificationResult.rejected(VerificationMethod.ON_CHAIN,
                    "Insufficient confirmations: " + confirmations + " < " + requiredConfirmations), receipt);
        }

        BigInteger expected = new BigInteger(requirements.amount);
        for (TransferReceipt.TokenTransfer t : receipt.getTransfers()) {
            if (!t.getToken().equalsIgnoreCase(requirements.asset) || !t.getTo().equalsIgnoreCase(requirements.payTo)) {
                continue;
            }
            if (t.getValue().compareTo(minimum(expected)) < 0) {
                VerificationResult short_ = VerificationResult.rejected(VerificationMethod.ON_CHAIN,
                        "Amount insufficient: expected " + expected + ", got " + t.getValue());
                short_.payer = t.getFrom();
                short_.paidAmount = t.getValue().toString();
                return withBlock(short_, receipt);
            }
            VerificationResult ok = VerificationResult.accepted(VerificationMethod.ON_CHAIN, t.getFrom(), t.getValue().toString());
            return withBlock(ok, receipt);
        }
        return withBlock(VerificationResult.rejected(VerificationMethod.ON_CHAIN,
                "No matching " + requirements.asset + " transfer found to " + requirements.payTo), receipt);
    }

    /** The transfer is already on chain; settling only records it. */
    @Override
    public SettlementResult settle(PaymentPayload payload, PaymentRequirements requirements) {
        TransferPayload transfer;
        try {
            transfer = TransferPayload.from(payload.payload);
        } catch (X402Exception e) {
            return SettlementResult.failed(e.getMessage(), clock.millis());
        }
        log.debug("x402 transfer {} on {} recorded as settled", transfer.txHash, requirements.network);
        SettlementResult r = SettlementResult.settled(SettlementStatus.CONFIRMED, transfer.txHash,
                requirements.network, transfer.from, clock.millis());
        r.netAmount = requirements.amount;
        return r;
    }

    /** Smallest acceptable value: {@code expected * (100 - tolerance) / 100}, rounded up. */
    BigInteger minimum(BigInteger expected) {
        if (amountTolerancePercent == 0) {
            return expected;
        }
        BigInteger scaled = expected.multiply(BigInteger.valueOf(100 - amountTolerancePercent));
        BigInteger[] qr = scaled.divideAndRemainder(HUNDRED);
        return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    }

    private static VerificationResult withTx(VerificationResult r, String txHash) {
        r.txHash = txHash;
        return r;
    }

    private static VerificationResult withBlock(VerificationResult r, TransferReceipt receipt) {
        r.txHash = receipt.getTxHash();
        r.blockNumber = receipt.getBlockNumber();
        r.timestamp = receipt.getBlockTimestamp() * 1000;
        return r;
    }
}
