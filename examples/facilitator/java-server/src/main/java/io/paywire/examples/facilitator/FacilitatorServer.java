package io.paywire.examples.facilitator;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.paywire.x402.facilitator.CachingFacilitatorClient;
import io.paywire.x402.facilitator.FacilitatorClient;
import io.paywire.x402.facilitator.FacilitatorRequest;
import io.paywire.x402.facilitator.LocalFacilitatorClient;
import io.paywire.x402.facilitator.SupportedResponse;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.scheme.SchemeRegistry;
import io.paywire.x402.scheme.transfer.TransferFacilitatorScheme;
import io.paywire.x402.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stand-alone facilitator exposing {@code POST /verify}, {@code POST /settle}
 * and {@code GET /supported} over whatever {@link FacilitatorClient} it wraps,
 * normally a {@link LocalFacilitatorClient}.
 *
 * Resource servers running in facilitator verification mode point
 * {@code x402.facilitator-url} at this process.
 */
public class FacilitatorServer {
    private static final Logger log = LoggerFactory.getLogger(FacilitatorServer.class);

    private final FacilitatorClient facilitator;
    private Javalin app;

    public FacilitatorServer(FacilitatorClient facilitator) {
        this.facilitator = Objects.requireNonNull(facilitator);
    }

    /** Starts listening; port 0 picks a free port, see {@link #port()}. */
    public FacilitatorServer start(int port) {
        app = Javalin.create(config -> config.showJavalinBanner = false);
        app.post("/verify", this::verify);
        app.post("/settle", this::settle);
        app.get("/supported", this::supported);
        app.start(port);
        log.info("x402 facilitator listening on port {}", app.port());
        return this;
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
    }

    /** POST /verify */
    private void verify(Context ctx) throws InterruptedException {
        FacilitatorRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }
        try {
            VerificationResult result = facilitator.verify(request.paymentPayload, request.paymentRequirements);
            log.debug("x402 verify {} on {}: valid={}", request.paymentRequirements.scheme,
                    request.paymentRequirements.network, result.valid);
            writeJson(ctx, 200, result);
        } catch (IOException e) {
            log.error("x402 verify failed: chain unreachable", e);
            writeError(ctx, 502, "facilitator_unreachable", e.getMessage());
        }
    }

    /** POST /settle */
    private void settle(Context ctx) throws InterruptedException {
        FacilitatorRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }
        try {
            SettlementResult result = facilitator.settle(request.paymentPayload, request.paymentRequirements);
            if (result.success) {
                log.info("x402 settled {} {} on {} tx={}", request.paymentRequirements.amount,
                        request.paymentRequirements.asset, result.network, result.transaction);
            } else {
                log.warn("x402 settlement failed on {}: {}", request.paymentRequirements.network, result.error);
            }
            writeJson(ctx, 200, result);
        } catch (IOException e) {
            log.error("x402 settle failed: chain unreachable", e);
            writeError(ctx, 502, "facilitator_unreachable", e.getMessage());
        }
    }

    /** GET /supported */
    private void supported(Context ctx) throws InterruptedException {
        try {
            writeJson(ctx, 200, new SupportedResponse(new ArrayList<>(facilitator.supported())));
        } catch (IOException e) {
            log.error("x402 supported lookup failed", e);
            writeError(ctx, 502, "facilitator_unreachable", e.getMessage());
        }
    }

    /** Parses the body, answering 400 and returning null when it is unusable. */
    private static FacilitatorRequest readRequest(Context ctx) {
        FacilitatorRequest request;
        try {
            request = Json.MAPPER.readValue(ctx.body(), FacilitatorRequest.class);
        } catch (JsonProcessingException e) {
            writeError(ctx, 400, "invalid_request", "malformed JSON body: " + e.getOriginalMessage());
            return null;
        }
        if (request == null || request.paymentPayload == null || request.paymentRequirements == null) {
            writeError(ctx, 400, "invalid_request", "paymentPayload and paymentRequirements are required");
            return null;
        }
        return request;
    }

    private static void writeError(Context ctx, int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        writeJson(ctx, status, body);
    }

    private static void writeJson(Context ctx, int status, Object body) {
        String json;
        try {
            json = Json.MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode " + body.getClass().getSimpleName(), e);
        }
        ctx.status(status).contentType("application/json").result(json);
    }

    public static void main(String[] args) {
        int port = Integer.parseInt(env("PORT", "8080"));
        String rpcUrl = System.getenv("RPC_URL");
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("RPC_URL is required");
        }
        String network = env("NETWORK", "eip155:8453");
        int confirmations = Integer.parseInt(env("CONFIRMATIONS", "1"));
        int tolerance = Integer.parseInt(env("AMOUNT_TOLERANCE_PERCENT", "0"));
        long cacheTtl = Long.parseLong(env("CACHE_TTL_SECONDS", "300"));

        EvmJsonRpcChainReader chain = new EvmJsonRpcChainReader(network, URI.create(rpcUrl));
        SchemeRegistry registry = new SchemeRegistry()
                .register(network, new TransferFacilitatorScheme(chain, confirmations, tolerance, Clock.systemUTC()));
        FacilitatorClient facilitator = new LocalFacilitatorClient(registry);
        if (cacheTtl > 0) {
            facilitator = new CachingFacilitatorClient(facilitator, Duration.ofSeconds(cacheTtl));
        }
        FacilitatorServer server = new FacilitatorServer(facilitator).start(port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            chain.shutdown();
        }));
    }

    private static String env(String name, String fallback) {
        String v = System.getenv(name);
        return v == null || v.isBlank() ? fallback : v.trim();
    }
}
