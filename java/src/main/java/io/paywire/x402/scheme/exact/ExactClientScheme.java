package io.paywire.x402.scheme.exact;

import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.crypto.CryptoSigner;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.scheme.ClientScheme;
import io.paywire.x402.util.Hashes;
import io.paywire.x402.util.Json;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Signs an exact transfer authorization for the selected requirement.
 * The authorization nonce is derived from the requirement, the payer and the
 * signing second, so re-signing the same requirement within the same second
 * reproduces the same payload.
 */
public class ExactClientScheme implements ClientScheme {
    private final CryptoSigner signer;
    private final String payer;
    private final Clock clock;

    public ExactClientScheme(CryptoSigner signer, String payer) {
        this(signer, payer, Clock.systemUTC());
    }

    public ExactClientScheme(CryptoSigner signer, String payer, Clock clock) {
        this.signer = Objects.requireNonNull(signer);
        this.payer = Objects.requireNonNull(payer);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public String schemeId() {
        return ExactServerScheme.SCHEME;
    }

    @Override
    public Map<String, Object> createPayload(PaymentRequirements requirements, ResourceInfo resource)
            throws CryptoSignException {
        if (requirements.payTo == null || requirements.amount == null) {
            throw new CryptoSignException("requirement has no payTo or amount: " + requirements);
        }
        long now = clock.instant().getEpochSecond();

        ExactAuthorization auth = new ExactAuthorization();
        auth.from = payer;
        auth.to = requirements.payTo;
        auth.value = requirements.amount;
        auth.validAfter = Long.toString(now);
        auth.validBefore = Long.toString(now + requirements.maxTimeoutSeconds);
        auth.nonce = Hashes.sha256Hex(Json.canonicalString(requirements) + "|" + payer + "|" + now);

        String signature = signer.sign(ExactPayload.signingInput(auth, requirements));
        return new ExactPayload(signature, auth).toMap();
    }
}
