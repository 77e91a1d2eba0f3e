package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.paywire.x402.util.Json;

import java.util.Map;

/**
 * Signed payment sent by the client in the {@code X-PAYMENT} header.
 * {@code accepted} must be one of the entries the server offered, unmodified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentPayload {
    public int x402Version;
    public ResourceInfo resource;
    public PaymentRequirements accepted;
    public Map<String, Object> payload;     // scheme-specific signed data
    public Map<String, Object> extensions;

    // accepted exactly as received, unknown members included; null when built locally
    private JsonNode acceptedJson;

    /** Default constructor for Jackson. */
    public PaymentPayload() {}

    public PaymentPayload(int x402Version, ResourceInfo resource, PaymentRequirements accepted,
                          Map<String, Object> payload) {
        this.x402Version = x402Version;
        this.resource = resource;
        this.accepted = accepted;
        this.payload = payload;
    }

    /** Base64-encoded JSON suitable for the {@code X-PAYMENT} header. */
    public String toHeader() {
        return Json.toBase64(this);
    }

    /**
     * Decodes a header carrying either base64 JSON or raw JSON.
     *
     * @throws IllegalArgumentException if the header is malformed or misses required members
     */
    public static PaymentPayload fromHeader(String header) {
        JsonNode tree = Json.treeFromBase64OrJson(header, "PaymentPayload");
        PaymentPayload p = Json.fromTree(tree, PaymentPayload.class);
        if (p.x402Version <= 0) {
            throw new IllegalArgumentException("payment payload has no x402Version");
        }
        if (p.accepted == null || p.accepted.scheme == null || p.accepted.network == null) {
            throw new IllegalArgumentException("payment payload has no accepted requirement");
        }
        if (p.payload == null || p.payload.isEmpty()) {
            throw new IllegalArgumentException("payment payload carries no scheme data");
        }
        p.acceptedJson = tree.get("accepted");
        return p;
    }

    /**
     * True when {@code accepted} is {@code offered} unchanged. For a decoded
     * header the comparison uses the received JSON, so members the model does
     * not declare still count as alterations.
     */
    public boolean acceptedMatches(PaymentRequirements offered) {
        if (offered == null || accepted == null) {
            return false;
        }
        if (acceptedJson == null) {
            return offered.sameAs(accepted);
        }
        return Json.canonicalTree(offered).equals(acceptedJson);
    }
}
