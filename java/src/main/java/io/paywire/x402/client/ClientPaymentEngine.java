package io.paywire.x402.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.paywire.x402.X402;
import io.paywire.x402.client.challenge.ChallengeParser;
import io.paywire.x402.client.challenge.ParseResult;
import io.paywire.x402.config.X402Config;
import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.scheme.ClientScheme;
import io.paywire.x402.scheme.SchemeRegistry;
import io.paywire.x402.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends a request and, if the server answers 402, pays and retries it once.
 *
 * <p>The retry is never repeated: a second 402 ends the negotiation with
 * {@link ErrorKind#PAYMENT_REJECTED}. Negotiation failures come back as a
 * {@link PaymentResult}; only transport errors and interruption are thrown.</p>
 */
public class ClientPaymentEngine {
    private static final Logger log = LoggerFactory.getLogger(ClientPaymentEngine.class);

    private final HttpClient http;
    private final SchemeRegistry registry;
    private final ChallengeParser parser;
    private final PaymentSelector selector;
    private final List<PaymentPolicy> policies;
    private final String paymentHeader;

    private ClientPaymentEngine(Builder b) {
        this.http = b.http != null ? b.http : HttpClient.newHttpClient();
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.parser = b.parser;
        this.selector = b.selector;
        this.policies = List.copyOf(b.policies);
        this.paymentHeader = b.paymentHeader;
    }

    public static Builder builder(SchemeRegistry registry) {
        return new Builder(registry);
    }

    /**
     * @throws IOException if a request cannot be sent
     * @throws InterruptedException if cancelled while waiting for a response
     */
    public PaymentResult execute(HttpRequest request) throws IOException, InterruptedException {
        PaymentResult result = new PaymentResult();
        HttpResponse<String> first = http.send(request, HttpResponse.BodyHandlers.ofString());
        result.response(first);
        if (first.statusCode() != 402) {
            return result;
        }

        result.enter(NegotiationState.CHALLENGED);
        ParseResult parsed = parser.parse(first.headers(), first.body());
        if (!parsed.isSuccess()) {
            log.warn("x402 unreadable challenge from {}: {}", request.uri(), parsed.failure());
            return result.fail(ErrorKind.INVALID_PAYLOAD, parsed.failure());
        }
        PaymentRequired challenge = parsed.challenge();
        result.challenge(challenge);

        result.enter(NegotiationState.SELECTING);
        List<PaymentRequirements> candidates = new ArrayList<>();
        for (PaymentRequirements r : challenge.accepts) {
            if (registry.resolveClient(r.scheme, r.network).isPresent()) {
                candidates.add(r);
            }
        }
        if (candidates.isEmpty()) {
            return result.fail(ErrorKind.NO_MATCHING_SCHEME, "no client scheme for any of " + challenge.accepts);
        }
        for (PaymentPolicy policy : policies) {
            candidates = policy.apply(candidates, request.uri());
        }
        Optional<PaymentRequirements> chosen = candidates.isEmpty() ? Optional.empty() : selector.select(candidates);
        if (chosen.isEmpty()) {
            return result.fail(ErrorKind.NO_MATCHING_SCHEME, "no offered requirement satisfies the payment policy");
        }
        PaymentRequirements selected = chosen.get();
        result.selected(selected);
        log.debug("x402 selected {} for {}", selected, request.uri());

        result.enter(NegotiationState.SIGNING);
        ClientScheme scheme = registry.resolveClient(selected.scheme, selected.network).orElseThrow();
        ResourceInfo resource = challenge.resource != null
                ? challenge.resource
                : new ResourceInfo(request.uri().toString(), null, null);
        PaymentPayload payment;
        try {
            Map<String, Object> data = scheme.createPayload(selected, resource);
            payment = new PaymentPayload(challenge.x402Version, resource, selected, data);
        } catch (CryptoSignException e) {
            log.warn("x402 signing failed for {}", selected, e);
            return result.fail(ErrorKind.INVALID_PAYLOAD, "signing failed: " + e.getMessage());
        }
        result.payment(payment);

        result.enter(NegotiationState.RETRYING);
        HttpRequest retry = HttpRequest.newBuilder(request, (name, value) -> !name.equalsIgnoreCase(paymentHeader))
                .header(paymentHeader, payment.toHeader())
                .build();
        HttpResponse<String> second = http.send(retry, HttpResponse.BodyHandlers.ofString());
        result.response(second);

        int status = second.statusCode();
        if (status == 402) {
            ParseResult again = parser.parse(second.headers(), second.body());
            String reason = again.isSuccess() && again.challenge().error != null
                    ? again.challenge().error : "payment was not accepted";
            log.warn("x402 payment rejected by {}: {}", request.uri(), reason);
            return result.fail(ErrorKind.PAYMENT_REJECTED, reason);
        }
        if (status < 200 || status >= 300) {
            return failFromErrorBody(result, second);
        }

        result.enter(NegotiationState.SETTLED);
        Optional<String> receipt = second.headers().firstValue(X402.PAYMENT_RESPONSE_HEADER);
        if (receipt.isPresent()) {
            try {
                result.settlement(SettlementResult.fromHeader(receipt.get()));
            } catch (IllegalArgumentException e) {
                log.warn("x402 unreadable {} header from {}", X402.PAYMENT_RESPONSE_HEADER, request.uri(), e);
            }
        }
        for (PaymentPolicy policy : policies) {
            policy.paid(selected, request.uri());
        }
        log.info("x402 paid {} {} on {} for {}", selected.amount, selected.asset, selected.network, request.uri());
        return result;
    }

    private static PaymentResult failFromErrorBody(PaymentResult result, HttpResponse<String> response) {
        ErrorKind kind = ErrorKind.PAYMENT_REJECTED;
        String message = "HTTP " + response.statusCode();
        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                ErrorBody error = Json.MAPPER.readValue(body, ErrorBody.class);
                if (error.error != null) {
                    kind = ErrorKind.fromCode(error.error).orElse(kind);
                }
                if (error.message != null) {
                    message = message + ": " + error.message;
                }
            } catch (JsonProcessingException e) {
                message = message + ": " + body;
            }
        }
        log.warn("x402 paid request failed: {} ({})", kind.code(), message);
        return result.fail(kind, message);
    }

    /** Error body of a failed paid request; only the fields the engine reads. */
    static class ErrorBody {
        public String error;
        public String message;
    }

    public static final class Builder {
        private final SchemeRegistry registry;
        private HttpClient http;
        private ChallengeParser parser = ChallengeParser.defaults();
        private PaymentSelector selector = PaymentSelectors.first();
        private final List<PaymentPolicy> policies = new ArrayList<>();
        private String paymentHeader = X402.PAYMENT_HEADER;

        private Builder(SchemeRegistry registry) {
            this.registry = registry;
        }

        public Builder httpClient(HttpClient http) {
            this.http = http;
            return this;
        }

        /** Takes the payment header name from {@code config}. */
        public Builder config(X402Config config) {
            this.paymentHeader = config.paymentHeader();
            return this;
        }

        public Builder parser(ChallengeParser parser) {
            this.parser = Objects.requireNonNull(parser);
            return this;
        }

        public Builder selector(PaymentSelector selector) {
            this.selector = Objects.requireNonNull(selector);
            return this;
        }

        public Builder policy(PaymentPolicy policy) {
            this.policies.add(Objects.requireNonNull(policy));
            return this;
        }

        public ClientPaymentEngine build() {
            return new ClientPaymentEngine(this);
        }
    }
}
