package io.paywire.x402.scheme.exact;

import io.paywire.x402.crypto.SignatureVerifier;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.scheme.FacilitatorScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/** Verifies exact authorizations by signature and settles them through a {@link SettlementBackend}. */
public class ExactFacilitatorScheme implements FacilitatorScheme {
    private static final Logger log = LoggerFactory.getLogger(ExactFacilitatorScheme.class);

    private final SignatureVerifier verifier;
    private final SettlementBackend backend;
    private final Clock clock;

    public ExactFacilitatorScheme(SignatureVerifier verifier, SettlementBackend backend) {
        this(verifier, backend, Clock.systemUTC());
    }

    public ExactFacilitatorScheme(SignatureVerifier verifier, SettlementBackend backend, Clock clock) {
        this.verifier = Objects.requireNonNull(verifier);
        this.backend = Objects.requireNonNull(backend);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public String schemeId() {
        return ExactServerScheme.SCHEME;
    }

    @Override
    public VerificationResult verify(PaymentPayload payload, PaymentRequirements requirements) {
        ExactPayload exact;
        try {
            exact = ExactPayload.from(payload.payload);
            checkTerms(exact.authorization, requirements);
        } catch (X402Exception e) {
            return reject(e.getMessage(), null);
        }
        ExactAuthorization auth = exact.authorization;
        if (!verifier.verify(ExactPayload.signingInput(auth, requirements), exact.signature, auth.from)) {
            return reject("invalid signature", auth.from);
        }
        VerificationResult ok = VerificationResult.accepted(VerificationMethod.SIGNATURE, auth.from, auth.value);
        ok.timestamp = clock.millis();
        return ok;
    }

    @Override
    public SettlementResult settle(PaymentPayload payload, PaymentRequirements requirements)
            throws IOException, InterruptedException {
        ExactPayload exact;
        try {
            exact = ExactPayload.from(payload.payload);
        } catch (X402Exception e) {
            return SettlementResult.failed(e.getMessage(), clock.millis());
        }
        SettlementResult r = backend.submit(exact.authorization, exact.signature, requirements);
        if (r == null) {
            return SettlementResult.failed("settlement backend returned no result", clock.millis());
        }
        if (r.network == null) {
            r.network = requirements.network;
        }
        if (r.payer == null) {
            r.payer = exact.authorization.from;
        }
        if (r.timestamp == 0) {
            r.timestamp = clock.millis();
        }
        log.debug("x402 exact settlement on {} tx {} success {}", r.network, r.transaction, r.success);
        return r;
    }

    private void checkTerms(ExactAuthorization auth, PaymentRequirements requirements) throws X402Exception {
        if (!auth.to.equalsIgnoreCase(requirements.payTo)) {
            throw X402Exception.invalidPayload("recipient mismatch: expected " + requirements.payTo + ", got " + auth.to);
        }
        if (ExactPayload.atomic(auth.value, "value").compareTo(ExactPayload.atomic(requirements.amount, "amount")) < 0) {
            throw X402Exception.invalidPayload("amount insufficient: expected " + requirements.amount + ", got " + auth.value);
        }
        long now = clock.instant().getEpochSecond();
        if (now < ExactPayload.seconds(auth.validAfter, "validAfter")) {
            throw X402Exception.invalidPayload("authorization not yet valid");
        }
        if (now >= ExactPayload.seconds(auth.validBefore, "validBefore")) {
            throw X402Exception.invalidPayload("authorization expired");
        }
    }

    private static VerificationResult reject(String reason, String payer) {
        VerificationResult r = VerificationResult.rejected(VerificationMethod.SIGNATURE, reason);
        r.payer = payer;
        return r;
    }
}
