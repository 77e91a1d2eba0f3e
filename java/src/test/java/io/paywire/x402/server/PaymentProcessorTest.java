package io.paywire.x402.server;

import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.facilitator.FacilitatorClient;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.SettlementStatus;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.nonce.InMemoryNonceStore;
import io.paywire.x402.nonce.NonceStore;
import io.paywire.x402.scheme.ServerScheme;
import io.paywire.x402.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentProcessorTest {

    private static final String NONCE = "0xproof";

    private FacilitatorClient facilitator;
    private ServerScheme scheme;
    private InMemoryNonceStore nonces;
    private PaymentProcessor processor;
    private PaymentRequirements req;
    private PaymentPayload payload;

    @BeforeEach
    void setUp() throws Exception {
        facilitator = mock(FacilitatorClient.class);
        scheme = mock(ServerScheme.class);
        when(scheme.proofNonce(any())).thenReturn(NONCE);
        nonces = new InMemoryNonceStore(Fixtures.fixedClock(), Duration.ofHours(1));
        processor = new PaymentProcessor(facilitator, nonces, Duration.ofMinutes(1));
        req = Fixtures.baseRequirement("10000");
        payload = new PaymentPayload(2, null, req, Map.of("signature", "0x1"));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private void verifies() throws Exception {
        when(facilitator.verify(any(), any()))
                .thenReturn(VerificationResult.accepted(VerificationMethod.SIGNATURE, Fixtures.PAYER, "10000"));
    }

    @Test
    void settlesAndFillsReceipt() throws Exception {
        verifies();
        when(facilitator.settle(any(), any()))
                .thenReturn(SettlementResult.settled(SettlementStatus.SETTLED, "0xtx", null, null, 1));

        ProcessResult r = processor.process(payload, req, scheme);
        assertEquals(ProcessResult.Type.PAID, r.type());
        assertEquals(Fixtures.PAYER, r.settlement().payer);
        assertEquals(Fixtures.BASE, r.settlement().network);
        assertTrue(nonces.has(NONCE));
    }

    @Test
    void spentNonceIsRejectedWithoutCallingFacilitator() throws Exception {
        nonces.add(NONCE, Duration.ofMinutes(5));
        X402Exception e = assertThrows(X402Exception.class, () -> processor.process(payload, req, scheme));
        assertEquals(ErrorKind.REPLAY_DETECTED, e.kind());
        verify(facilitator, never()).verify(any(), any());
    }

    @Test
    void facilitatorReportedReplayKeepsItsKind() throws Exception {
        when(facilitator.verify(any(), any())).thenReturn(VerificationResult.replay(NONCE));
        X402Exception e = assertThrows(X402Exception.class, () -> processor.process(payload, req, scheme));
        assertEquals(ErrorKind.REPLAY_DETECTED, e.kind());
        assertFalse(nonces.has(NONCE));
    }

    @Test
    void missingVerificationIsFailure() throws Exception {
        when(facilitator.verify(any(), any())).thenReturn(null);
        X402Exception e = assertThrows(X402Exception.class, () -> processor.process(payload, req, scheme));
        assertEquals(ErrorKind.VERIFICATION_FAILED, e.kind());
        assertEquals("payment verification failed", e.getMessage());
    }

    @Test
    void nonceOutlivesThePaymentWindow() throws Exception {
        NonceStore store = mock(NonceStore.class);
        when(store.add(any(), any())).thenReturn(true);
        verifies();
        when(facilitator.settle(any(), any()))
                .thenReturn(SettlementResult.settled(SettlementStatus.SETTLED, "0xtx", null, null, 1));

        new PaymentProcessor(facilitator, store, Duration.ofMinutes(1)).process(payload, req, scheme);
        verify(store).add(eq(NONCE), eq(Duration.ofSeconds(300)));

        new PaymentProcessor(facilitator, store, Duration.ofHours(2)).process(payload, req, scheme);
        verify(store).add(eq(NONCE), eq(Duration.ofHours(2)));
    }

    @Test
    void interruptBeforeSettlementReleasesNonce() throws Exception {
        verifies();
        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class, () -> processor.process(payload, req, scheme));
        assertFalse(nonces.has(NONCE));
        verify(facilitator, never()).settle(any(), any());
    }

    @Test
    void unreachableSettlementKeepsNonceConsumed() throws Exception {
        verifies();
        when(facilitator.settle(any(), any())).thenThrow(new IOException("read timed out"));

        X402Exception e = assertThrows(X402Exception.class, () -> processor.process(payload, req, scheme));
        assertEquals(ErrorKind.FACILITATOR_UNREACHABLE, e.kind());
        assertTrue(nonces.has(NONCE));
        verify(facilitator, times(1)).settle(any(), any());
    }

    @Test
    void failedSettlementCarriesReason() throws Exception {
        verifies();
        when(facilitator.settle(any(), any())).thenReturn(SettlementResult.failed("reverted", 1));

        X402Exception e = assertThrows(X402Exception.class, () -> processor.process(payload, req, scheme));
        assertEquals(ErrorKind.SETTLEMENT_FAILED, e.kind());
        assertEquals("reverted", e.getMessage());
        assertTrue(nonces.has(NONCE));
    }
}
