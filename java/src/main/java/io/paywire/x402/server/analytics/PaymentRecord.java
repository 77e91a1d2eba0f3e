package io.paywire.x402.server.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/** One accepted payment, as seen by the resource server. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRecord {
    public String id;

    /** Settlement transaction, if the scheme produced one. */
    public String txHash;

    public String network;

    public String asset;

    /** Amount paid, atomic units. */
    public String amount;

    public String payer;

    /** Request path of the paid resource. */
    public String resource;

    /** HTTP method of the paid request. */
    public String method;

    /** Epoch millis. */
    public long timestamp;

    public PaymentRecord() {}

    public PaymentRecord(String txHash, String network, String asset, String amount, String payer,
                         String resource, String method, long timestamp) {
        this.id = "pay_" + UUID.randomUUID().toString().replace("-", "");
        this.txHash = txHash;
        this.network = network;
        this.asset = asset;
        this.amount = amount;
        this.payer = payer;
        this.resource = resource;
        this.method = method;
        this.timestamp = timestamp;
    }
}
