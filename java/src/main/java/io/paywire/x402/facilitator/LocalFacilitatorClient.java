package io.paywire.x402.facilitator;

import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.scheme.FacilitatorScheme;
import io.paywire.x402.scheme.SchemeRegistry;
import io.paywire.x402.scheme.SchemeRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Facilitator running in-process: dispatches to the FACILITATOR-role scheme
 * registered for the requirement's scheme and network. Used for on-chain
 * verification without an external service, and as the engine behind the
 * stand-alone facilitator server.
 */
public class LocalFacilitatorClient implements FacilitatorClient {
    private static final Logger log = LoggerFactory.getLogger(LocalFacilitatorClient.class);

    private final SchemeRegistry registry;
    private final Clock clock;

    public LocalFacilitatorClient(SchemeRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public LocalFacilitatorClient(SchemeRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public VerificationResult verify(PaymentPayload payload, PaymentRequirements req)
            throws IOException, InterruptedException {
        Optional<FacilitatorScheme> scheme = schemeFor(req);
        if (scheme.isEmpty()) {
            return VerificationResult.rejected(VerificationMethod.FACILITATOR, unsupported(req));
        }
        return scheme.get().verify(payload, req);
    }

    @Override
    public SettlementResult settle(PaymentPayload payload, PaymentRequirements req)
            throws IOException, InterruptedException {
        Optional<FacilitatorScheme> scheme = schemeFor(req);
        if (scheme.isEmpty()) {
            return SettlementResult.failed(unsupported(req), clock.millis());
        }
        return scheme.get().settle(payload, req);
    }

    @Override
    public Set<Kind> supported() {
        Set<Kind> kinds = new LinkedHashSet<>();
        for (SchemeRegistry.Registration r : registry.registrations(SchemeRole.FACILITATOR)) {
            kinds.add(new Kind(r.schemeId, r.pattern.toString()));
        }
        return kinds;
    }

    private Optional<FacilitatorScheme> schemeFor(PaymentRequirements req) {
        if (req == null) {
            return Optional.empty();
        }
        Optional<FacilitatorScheme> scheme = registry.resolveFacilitator(req.scheme, req.network);
        if (scheme.isEmpty()) {
            log.warn("x402 no facilitator scheme for {} on {}", req.scheme, req.network);
        }
        return scheme;
    }

    private static String unsupported(PaymentRequirements req) {
        return req == null
                ? "missing payment requirements"
                : "unsupported scheme '" + req.scheme + "' on network " + req.network;
    }
}
