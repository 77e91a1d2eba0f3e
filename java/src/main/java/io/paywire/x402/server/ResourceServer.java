package io.paywire.x402.server;

import io.paywire.x402.X402;
import io.paywire.x402.config.VerificationMode;
import io.paywire.x402.config.X402Config;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.facilitator.FacilitatorClient;
import io.paywire.x402.facilitator.HttpFacilitatorClient;
import io.paywire.x402.facilitator.LocalFacilitatorClient;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.nonce.NonceStore;
import io.paywire.x402.scheme.SchemeRegistry;
import io.paywire.x402.scheme.ServerScheme;
import io.paywire.x402.server.analytics.PaymentListener;
import io.paywire.x402.server.analytics.PaymentRecord;
import io.paywire.x402.server.pricing.AtomicAmounts;
import io.paywire.x402.server.pricing.PriceResult;
import io.paywire.x402.server.pricing.PricingContext;
import io.paywire.x402.util.AuthParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server side of the negotiation: challenges unpaid requests to paid routes
 * and checks, verifies and settles the payments that come back.
 *
 * <p>Inbound payments are checked in a fixed order: header decoding, then
 * membership of {@code accepted} in the offered set, then the deadline, then
 * the scheme, then verification and settlement. The first failing step
 * decides the result.</p>
 */
public class ResourceServer {
    private static final Logger log = LoggerFactory.getLogger(ResourceServer.class);

    private final X402Config config;
    private final SchemeRegistry registry;
    private final PaymentProcessor processor;
    private final Clock clock;
    private final List<RouteConfig> routes = new CopyOnWriteArrayList<>();
    private final List<PaymentListener> listeners = new CopyOnWriteArrayList<>();

    public ResourceServer(X402Config config, SchemeRegistry registry, FacilitatorClient facilitator,
                          NonceStore nonces, Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.registry = Objects.requireNonNull(registry);
        this.clock = Objects.requireNonNull(clock);
        this.processor = new PaymentProcessor(facilitator, nonces, config.nonceTtl());
    }

    /** Server whose facilitator follows {@link X402Config#verificationMode()}. */
    public static ResourceServer create(X402Config config, SchemeRegistry registry, NonceStore nonces) {
        FacilitatorClient facilitator;
        if (config.verificationMode() == VerificationMode.FACILITATOR) {
            facilitator = HttpFacilitatorClient.withApiKey(config.facilitatorUrl(), config.facilitatorTimeout(),
                    config.facilitatorApiKey());
        } else {
            facilitator = new LocalFacilitatorClient(registry);
        }
        return new ResourceServer(config, registry, facilitator, nonces, Clock.systemUTC());
    }

    public ResourceServer addRoute(RouteConfig route) {
        routes.add(Objects.requireNonNull(route));
        return this;
    }

    /** Registers a listener told about every accepted payment. Listener failures are logged and ignored. */
    public ResourceServer onPayment(PaymentListener listener) {
        listeners.add(Objects.requireNonNull(listener));
        return this;
    }

    /** First registered route covering the request, in registration order. */
    public Optional<RouteConfig> matchRoute(String method, String path) {
        for (RouteConfig r : routes) {
            if (r.matches(method, path)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the challenge for {@code route}: one entry per accept option, in
     * declared order, priced for this request.
     *
     * @param error reason for a renewed challenge, or null
     * @throws IllegalStateException if an option has neither a price nor a payee
     */
    public PaymentRequired buildPaymentRequired(RouteConfig route, HttpRequestContext request, String error) {
        PriceResult quote = null;
        if (route.priceCalculator() != null) {
            quote = route.priceCalculator().calculate(pricingContext(request));
            log.debug("x402 price for {} {}: {} ({})", request.method(), request.path(), quote.price, quote.breakdown);
        }

        List<PaymentRequirements> accepts = new ArrayList<>();
        for (AcceptOption option : route.accepts()) {
            accepts.add(requirementsFor(option, quote));
        }
        PaymentRequired pr = new PaymentRequired(X402.VERSION,
                new ResourceInfo(request.url(), route.description(), route.mimeType()), accepts);
        pr.error = error;
        return pr;
    }

    /** {@code WWW-Authenticate} header describing the preferred entry of {@code challenge}. */
    public Map<String, String> challengeHeaders(PaymentRequired challenge) {
        PaymentRequirements first = challenge.accepts.get(0);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("scheme", first.scheme);
        params.put("amount", first.amount);
        params.put("recipient", first.payTo);
        params.put("token", first.asset);
        params.put("chain", first.network);
        params.put("timeout", Integer.toString(first.maxTimeoutSeconds));
        params.put("description", challenge.resource != null ? challenge.resource.description : null);
        params.put("deadline", Long.toString(clock.instant().getEpochSecond() + first.maxTimeoutSeconds));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(X402.WWW_AUTHENTICATE_HEADER, AuthParams.format(X402.AUTH_SCHEME, params));
        return headers;
    }

    /**
     * Decides what happens to {@code request}.
     *
     * @throws InterruptedException if interrupted before settlement was attempted
     */
    public ProcessResult processRequest(HttpRequestContext request) throws InterruptedException {
        Optional<RouteConfig> route = matchRoute(request.method(), request.path());
        if (route.isEmpty()) {
            return ProcessResult.noPaymentRequired();
        }

        PaymentRequired offered = buildPaymentRequired(route.get(), request, null);
        String header = request.header(config.paymentHeader());
        if (header == null || header.isBlank()) {
            log.debug("x402 challenge for {} {}", request.method(), request.path());
            offered.error = config.paymentHeader() + " header is required";
            return ProcessResult.paymentRequired(offered, challengeHeaders(offered), null, null);
        }

        try {
            PaymentPayload payload = decode(header);
            PaymentRequirements accepted = findOffered(offered, payload);
            Optional<ServerScheme> scheme = registry.resolveServer(accepted.scheme, accepted.network);
            if (scheme.isPresent()) {
                checkDeadline(scheme.get().deadline(payload, accepted));
            }
            ServerScheme serverScheme = scheme.orElseThrow(() -> X402Exception.noMatchingScheme(
                    "no server scheme '" + accepted.scheme + "' for " + accepted.network));
            serverScheme.validate(payload, accepted);
            ProcessResult result = processor.process(payload, accepted, serverScheme);
            if (result.type() == ProcessResult.Type.PAID) {
                notifyPaid(result, request);
            }
            return result;
        } catch (X402Exception e) {
            return reject(e, offered, request);
        } catch (DateTimeException | ArithmeticException e) {
            return reject(X402Exception.invalidPayload("payment timing out of range: " + e.getMessage(), e),
                    offered, request);
        }
    }

    private void notifyPaid(ProcessResult paid, HttpRequestContext request) {
        if (listeners.isEmpty()) {
            return;
        }
        PaymentRequirements r = paid.requirements();
        VerificationResult v = paid.verification();
        String amount = v != null && v.paidAmount != null ? v.paidAmount : r.amount;
        String payer = paid.settlement().payer != null ? paid.settlement().payer : v != null ? v.payer : null;
        PaymentRecord record = new PaymentRecord(paid.settlement().transaction, r.network, r.asset, amount, payer,
                request.path(), request.method(), clock.millis());
        for (PaymentListener listener : listeners) {
            try {
                listener.onPayment(record);
            } catch (RuntimeException e) {
                log.warn("x402 payment listener failed for {} {}", request.method(), request.path(), e);
            }
        }
    }

    private ProcessResult reject(X402Exception e, PaymentRequired offered, HttpRequestContext request) {
        ErrorKind kind = e.kind();
        log.warn("x402 payment rejected for {} {}: {} ({})", request.method(), request.path(), kind.code(),
                e.getMessage());
        if (!kind.renewsChallenge()) {
            return ProcessResult.paymentError(kind, e.getMessage());
        }
        offered.error = e.getMessage();
        VerificationResult verification = kind == ErrorKind.REPLAY_DETECTED
                ? VerificationResult.replay(e.getMessage())
                : null;
        return ProcessResult.paymentRequired(offered, challengeHeaders(offered), kind, verification);
    }

    private static PaymentPayload decode(String header) throws X402Exception {
        try {
            return PaymentPayload.fromHeader(header);
        } catch (IllegalArgumentException e) {
            throw X402Exception.invalidPayload("malformed payment header: " + e.getMessage(), e);
        }
    }

    private static PaymentRequirements findOffered(PaymentRequired offered, PaymentPayload payload)
            throws X402Exception {
        for (PaymentRequirements r : offered.accepts) {
            if (payload.acceptedMatches(r)) {
                return r;
            }
        }
        throw X402Exception.requirementMismatch("accepted requirement " + payload.accepted
                + " is not one of the offered requirements");
    }

    private void checkDeadline(Instant deadline) throws X402Exception {
        Instant now = clock.instant();
        if (!now.isBefore(deadline)) {
            throw X402Exception.deadlineExpired("payment deadline " + deadline + " has passed");
        }
    }

    private PaymentRequirements requirementsFor(AcceptOption option, PriceResult quote) {
        BigDecimal price = quote != null ? quote.price : option.price;
        if (price == null) {
            throw new IllegalStateException("accept option " + option.scheme + "@" + option.network + " has no price");
        }
        String payTo = option.payTo != null ? option.payTo : config.walletAddress();
        if (payTo == null) {
            throw new IllegalStateException("no payTo for " + option.scheme + "@" + option.network
                    + " and no wallet address configured");
        }
        PaymentRequirements r = new PaymentRequirements();
        r.scheme = option.scheme;
        r.network = option.network != null ? option.network : config.defaultNetwork();
        r.asset = option.asset != null ? option.asset : config.defaultAsset();
        r.amount = AtomicAmounts.toAtomic(price, option.assetDecimals);
        r.payTo = payTo;
        r.maxTimeoutSeconds = option.maxTimeoutSeconds > 0 ? option.maxTimeoutSeconds : config.defaultMaxTimeoutSeconds();
        r.extra = new LinkedHashMap<>(option.extra);
        Optional<ServerScheme> scheme = registry.resolveServer(r.scheme, r.network);
        return scheme.isPresent() ? scheme.get().enhance(r) : r;
    }

    private static PricingContext pricingContext(HttpRequestContext request) {
        return new PricingContext(request.path(), request.method(), request.clientIp(),
                request.header("X-Client-Address"), request.bodySize(), request.metadata());
    }
}
