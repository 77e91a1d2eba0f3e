package io.paywire.x402.facilitator;

import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Synchronous facilitator client using Java 11 HttpClient. */
public class HttpFacilitatorClient implements FacilitatorClient {
    private static final Logger log = LoggerFactory.getLogger(HttpFacilitatorClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;
    private final Map<String, String> headers;

    /**
     * Creates a new HTTP facilitator client.
     *
     * @param baseUrl the base URL of the facilitator service (trailing slash will be removed)
     */
    public HttpFacilitatorClient(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT, Collections.emptyMap());
    }

    /**
     * @param baseUrl the base URL of the facilitator service
     * @param timeout per-request timeout
     * @param headers extra headers sent with every request, e.g. an API key
     */
    public HttpFacilitatorClient(String baseUrl, Duration timeout, Map<String, String> headers) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.headers = new LinkedHashMap<>(headers);
        this.http = HttpClient.newBuilder().connectTimeout(this.timeout).build();
    }

    /** Client authenticating with {@code Authorization: Bearer <apiKey>} when a key is given. */
    public static HttpFacilitatorClient withApiKey(String baseUrl, Duration timeout, String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "Bearer " + apiKey);
        }
        return new HttpFacilitatorClient(baseUrl, timeout, headers);
    }

    @Override
    public VerificationResult verify(PaymentPayload payload, PaymentRequirements req)
            throws IOException, InterruptedException {
        String body = post("/verify", new FacilitatorRequest(payload, req));
        VerificationResult result = Json.MAPPER.readValue(body, VerificationResult.class);
        if (result == null) {
            throw new IOException("empty facilitator response from /verify");
        }
        log.debug("x402 facilitator verify: valid={} error={}", result.valid, result.error);
        return result;
    }

    @Override
    public SettlementResult settle(PaymentPayload payload, PaymentRequirements req)
            throws IOException, InterruptedException {
        String body = post("/settle", new FacilitatorRequest(payload, req));
        SettlementResult result = Json.MAPPER.readValue(body, SettlementResult.class);
        if (result == null) {
            throw new IOException("empty facilitator response from /settle");
        }
        log.debug("x402 facilitator settle: success={} tx={}", result.success, result.transaction);
        return result;
    }

    @Override
    public Set<Kind> supported() throws IOException, InterruptedException {
        HttpRequest request = request("/supported").GET().build();
        String body = send(request);
        SupportedResponse response = Json.MAPPER.readValue(body, SupportedResponse.class);
        Set<Kind> kinds = new LinkedHashSet<>();
        if (response != null && response.kinds != null) {
            kinds.addAll(response.kinds);
        }
        return kinds;
    }

    private String post(String path, Object body) throws IOException, InterruptedException {
        HttpRequest request = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                .build();
        return send(request);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path)).timeout(timeout);
        headers.forEach(b::header);
        return b;
    }

    private String send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + ": " + response.body());
        }
        return response.body();
    }
}
