package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.paywire.x402.util.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/** Defines one acceptable way to pay for a resource. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRequirements {
    public String scheme;              // e.g. "exact"
    public String network;             // CAIP-2, e.g. "eip155:8453"
    public String asset;               // token contract address / mint
    public String amount;              // atomic units, decimal string
    public String payTo;               // recipient address
    public int maxTimeoutSeconds;      // validity window from issuance
    public Map<String, Object> extra = new LinkedHashMap<>();  // scheme-specific

    /** Default constructor for Jackson. */
    public PaymentRequirements() {}

    public PaymentRequirements(String scheme, String network, String asset, String amount,
                               String payTo, int maxTimeoutSeconds) {
        this.scheme = scheme;
        this.network = network;
        this.asset = asset;
        this.amount = amount;
        this.payTo = payTo;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
    }

    /** Deep copy, so an issued entry can be handed out without exposing its {@code extra} map. */
    @SuppressWarnings("unchecked")
    public PaymentRequirements copy() {
        PaymentRequirements c = new PaymentRequirements(scheme, network, asset, amount, payTo, maxTimeoutSeconds);
        c.extra = extra == null ? null : Json.MAPPER.convertValue(extra, LinkedHashMap.class);
        return c;
    }

    /**
     * True when both requirements serialize to the same JSON tree. Any altered
     * field, including inside {@code extra}, makes them differ.
     */
    public boolean sameAs(PaymentRequirements other) {
        if (other == null) {
            return false;
        }
        return Json.canonicalTree(this).equals(Json.canonicalTree(other));
    }

    @Override
    public String toString() {
        return scheme + "@" + network + " " + amount + " " + asset + " -> " + payTo;
    }
}
