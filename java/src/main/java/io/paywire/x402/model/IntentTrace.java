package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured context for a payment decision: why a payload was rejected, why
 * settlement failed, or why a client gave up.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntentTrace {
    /** Wire code of the failure kind, e.g. {@code replay_detected}. */
    @JsonProperty("reason_code")
    public String reasonCode;

    /** Human-readable summary (max 500 chars). */
    @JsonProperty("trace_summary")
    public String traceSummary;

    /** Flat key-value object for additional context. Values must be String, Number, or Boolean. */
    public Map<String, Object> metadata;

    /** Suggested action to resolve the issue. */
    public Remediation remediation;

    /** Default constructor for Jackson. */
    public IntentTrace() {}

    public IntentTrace(String reasonCode, String traceSummary) {
        this.reasonCode = reasonCode;
        this.traceSummary = truncate(traceSummary);
    }

    public IntentTrace(String reasonCode, String traceSummary, Remediation remediation) {
        this(reasonCode, traceSummary);
        this.remediation = remediation;
    }

    /** Adds one metadata entry, creating the map on first use. */
    public IntentTrace with(String key, Object value) {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        metadata.put(key, value);
        return this;
    }

    private static String truncate(String s) {
        return s != null && s.length() > 500 ? s.substring(0, 500) : s;
    }
}
