package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.paywire.x402.util.Json;

/**
 * JSON returned by POST /settle, and the receipt that gets base64-encoded
 * into X-PAYMENT-RESPONSE.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SettlementResult {
    /** Whether the payment settlement succeeded. */
    public boolean success;

    /** Facilitator-side settlement identifier. */
    public String settlementId;

    /** Transaction hash of the settled payment. */
    @JsonAlias("txHash")
    public String transaction;

    /** Network where the settlement occurred. */
    @JsonAlias("networkId")
    public String network;

    /** Wallet address of the person who made the payment. */
    public String payer;

    /** Amount after fees, atomic units. */
    public String netAmount;

    public String fee;

    public SettlementStatus status = SettlementStatus.PENDING;

    /** Error message if settlement failed. */
    public String error;

    /** Epoch millis. */
    public long timestamp;

    /** Structured context for why settlement failed. */
    public IntentTrace intentTrace;

    /** Default constructor for Jackson. */
    public SettlementResult() {}

    public static SettlementResult settled(SettlementStatus status, String transaction, String network,
                                           String payer, long timestamp) {
        SettlementResult r = new SettlementResult();
        r.success = true;
        r.status = status;
        r.transaction = transaction;
        r.network = network;
        r.payer = payer;
        r.timestamp = timestamp;
        return r;
    }

    public static SettlementResult failed(String error, long timestamp) {
        SettlementResult r = new SettlementResult();
        r.success = false;
        r.status = SettlementStatus.FAILED;
        r.error = error;
        r.timestamp = timestamp;
        return r;
    }

    /** Base64-encoded JSON for the X-PAYMENT-RESPONSE header. */
    public String toHeader() {
        return Json.toBase64(this);
    }

    /** @throws IllegalArgumentException if the header cannot be decoded */
    public static SettlementResult fromHeader(String header) {
        return Json.fromBase64OrJson(header, SettlementResult.class);
    }
}
