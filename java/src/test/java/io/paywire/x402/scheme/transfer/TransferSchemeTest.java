package io.paywire.x402.scheme.transfer;

import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.SettlementStatus;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransferSchemeTest {

    private static final String TX = "0x" + "ab".repeat(32);
    private static final long BLOCK = 1_000;
    private static final long BLOCK_TIME = Fixtures.NOW.getEpochSecond() - 30;

    private final FakeChain chain = new FakeChain();
    private final TransferFacilitatorScheme facilitator =
            new TransferFacilitatorScheme(chain, 2, Fixtures.fixedClock());
    private final TransferServerScheme server = new TransferServerScheme();

    private static PaymentRequirements requirement(String amount) {
        return new PaymentRequirements("transfer", Fixtures.BASE, Fixtures.USDC_BASE, amount, Fixtures.MERCHANT, 300);
    }

    private static PaymentPayload payload(PaymentRequirements req, String tx) {
        return new PaymentPayload(2, null, req,
                new TransferPayload(tx, Fixtures.PAYER, Fixtures.NOW.getEpochSecond()).toMap());
    }

    private static TransferReceipt.TokenTransfer toMerchant(String value) {
        return new TransferReceipt.TokenTransfer(Fixtures.USDC_BASE.toLowerCase(), Fixtures.PAYER,
                Fixtures.MERCHANT, new BigInteger(value));
    }

    @Test
    void clientPresentsSubmittedTransaction() throws Exception {
        TransferSubmitter submitter = new TransferSubmitter() {
            @Override
            public String address() {
                return Fixtures.PAYER;
            }

            @Override
            public String transfer(PaymentRequirements requirements) {
                return TX;
            }
        };
        TransferClientScheme client = new TransferClientScheme(submitter, Fixtures.fixedClock());

        TransferPayload p = TransferPayload.from(client.createPayload(requirement("500"), null));
        assertEquals(TX, p.txHash);
        assertEquals(Fixtures.PAYER, p.from);
        assertEquals(Fixtures.NOW.getEpochSecond(), p.submittedAt);
    }

    @Test
    void clientWrapsSubmissionFailure() {
        TransferSubmitter broken = new TransferSubmitter() {
            @Override
            public String address() {
                return Fixtures.PAYER;
            }

            @Override
            public String transfer(PaymentRequirements requirements) throws IOException {
                throw new IOException("nonce too low");
            }
        };
        CryptoSignException e = assertThrows(CryptoSignException.class,
                () -> new TransferClientScheme(broken).createPayload(requirement("500"), null));
        assertTrue(e.getMessage().contains("nonce too low"));
    }

    @Test
    void serverUsesLowercasedHashAsNonce() throws Exception {
        String mixed = "0x" + "AB".repeat(32);
        assertEquals(TX, server.proofNonce(payload(requirement("500"), mixed)));
    }

    @Test
    void serverDeadlineStartsAtSubmission() throws Exception {
        assertEquals(Fixtures.NOW.plusSeconds(300), server.deadline(payload(requirement("500"), TX), requirement("500")));
    }

    @Test
    void serverRejectsSubmissionTimeOutOfRange() {
        PaymentRequirements req = requirement("500");
        PaymentPayload far = new PaymentPayload(2, null, req,
                new TransferPayload(TX, Fixtures.PAYER, Long.MAX_VALUE).toMap());

        X402Exception e = assertThrows(X402Exception.class, () -> server.deadline(far, req));
        assertEquals(ErrorKind.INVALID_PAYLOAD, e.kind());
        assertTrue(e.getMessage().contains("submittedAt is out of range"), e.getMessage());
    }

    @Test
    void serverRejectsMalformedHash() {
        PaymentRequirements req = requirement("500");
        X402Exception e = assertThrows(X402Exception.class, () -> server.validate(payload(req, "deadbeef"), req));
        assertEquals(ErrorKind.INVALID_PAYLOAD, e.kind());

        Map<String, Object> noTime = new HashMap<>(Map.of("txHash", TX));
        assertThrows(X402Exception.class,
                () -> server.validate(new PaymentPayload(2, null, req, noTime), req));
    }

    @Test
    void confirmedTransferIsAccepted() throws Exception {
        chain.latest = BLOCK + 2;
        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(toMerchant("500"))));
        PaymentRequirements req = requirement("500");

        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertTrue(vr.valid, vr.error);
        assertEquals(VerificationMethod.ON_CHAIN, vr.method);
        assertEquals(Fixtures.PAYER, vr.payer);
        assertEquals("500", vr.paidAmount);
        assertEquals(TX, vr.txHash);
        assertEquals(BLOCK, vr.blockNumber);
        assertEquals(BLOCK_TIME * 1000, vr.timestamp);
    }

    @Test
    void unknownTransactionIsRejected() throws Exception {
        PaymentRequirements req = requirement("500");
        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertFalse(vr.valid);
        assertEquals("Transaction not found", vr.error);
        assertEquals(TX, vr.txHash);
    }

    @Test
    void revertedTransactionIsRejected() throws Exception {
        chain.latest = BLOCK + 10;
        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, false, BLOCK_TIME, List.of(toMerchant("500"))));
        PaymentRequirements req = requirement("500");

        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertFalse(vr.valid);
        assertEquals("Transaction failed or reverted", vr.error);
    }

    @Test
    void shallowTransactionIsRejected() throws Exception {
        chain.latest = BLOCK + 1;
        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(toMerchant("500"))));
        PaymentRequirements req = requirement("500");

        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertFalse(vr.valid);
        assertEquals("Insufficient confirmations: 1 < 2", vr.error);
    }

    @Test
    void underpaymentIsRejectedWithPaidAmount() throws Exception {
        chain.latest = BLOCK + 5;
        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(toMerchant("499"))));
        PaymentRequirements req = requirement("500");

        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertFalse(vr.valid);
        assertEquals("499", vr.paidAmount);
        assertTrue(vr.error.startsWith("Amount insufficient"));
    }

    @Test
    void toleranceAcceptsSlightShortfall() throws Exception {
        TransferFacilitatorScheme tolerant = new TransferFacilitatorScheme(chain, 2, 2, Fixtures.fixedClock());
        chain.latest = BLOCK + 5;
        PaymentRequirements req = requirement("500");

        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(toMerchant("490"))));
        VerificationResult enough = tolerant.verify(payload(req, TX), req);
        assertTrue(enough.valid, enough.error);
        assertEquals("490", enough.paidAmount);

        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(toMerchant("489"))));
        VerificationResult shortfall = tolerant.verify(payload(req, TX), req);
        assertFalse(shortfall.valid);
        assertEquals("Amount insufficient: expected 500, got 489", shortfall.error);
    }

    @Test
    void toleranceRoundsInFavourOfThePayee() {
        TransferFacilitatorScheme tolerant = new TransferFacilitatorScheme(chain, 2, 10, Fixtures.fixedClock());
        assertEquals(BigInteger.valueOf(3), tolerant.minimum(BigInteger.valueOf(3)));
        assertEquals(BigInteger.valueOf(900), tolerant.minimum(BigInteger.valueOf(1000)));
        assertEquals(BigInteger.valueOf(500), facilitator.minimum(BigInteger.valueOf(500)));
        assertThrows(IllegalArgumentException.class,
                () -> new TransferFacilitatorScheme(chain, 2, 101, Fixtures.fixedClock()));
    }

    @Test
    void transferOfOtherTokenDoesNotCount() throws Exception {
        chain.latest = BLOCK + 5;
        TransferReceipt.TokenTransfer otherToken = new TransferReceipt.TokenTransfer(
                "0x3333333333333333333333333333333333333333", Fixtures.PAYER, Fixtures.MERCHANT, BigInteger.valueOf(500));
        chain.receipts.put(TX, new TransferReceipt(TX, BLOCK, true, BLOCK_TIME, List.of(otherToken)));
        PaymentRequirements req = requirement("500");

        VerificationResult vr = facilitator.verify(payload(req, TX), req);
        assertFalse(vr.valid);
        assertTrue(vr.error.startsWith("No matching"));
    }

    @Test
    void settlementRecordsTheExistingTransfer() {
        PaymentRequirements req = requirement("500");
        SettlementResult sr = facilitator.settle(payload(req, TX), req);

        assertTrue(sr.success);
        assertEquals(SettlementStatus.CONFIRMED, sr.status);
        assertEquals(TX, sr.transaction);
        assertEquals(Fixtures.PAYER, sr.payer);
        assertEquals("500", sr.netAmount);
        assertEquals(Fixtures.NOW.toEpochMilli(), sr.timestamp);
    }

    private static class FakeChain implements ChainReader {
        final Map<String, TransferReceipt> receipts = new HashMap<>();
        long latest;

        @Override
        public Optional<TransferReceipt> receipt(String network, String txHash) {
            return Optional.ofNullable(receipts.get(txHash));
        }

        @Override
        public long latestBlock(String network) {
            return latest;
        }
    }
}
