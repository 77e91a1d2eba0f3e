package io.paywire.x402.scheme.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.scheme.ServerScheme;
import io.paywire.x402.util.Json;

import java.util.Map;

/** Scheme data of a pre-paid transfer: the hash of a transaction the client already broadcast. */
public class TransferPayload {
    public String txHash;
    public String from;
    /** Epoch seconds at which the client submitted the transfer. */
    public long submittedAt;

    /** Default constructor for Jackson. */
    public TransferPayload() {}

    public TransferPayload(String txHash, String from, long submittedAt) {
        this.txHash = txHash;
        this.from = from;
        this.submittedAt = submittedAt;
    }

    public Map<String, Object> toMap() {
        return Json.MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
    }

    /** @throws X402Exception with {@code INVALID_PAYLOAD} */
    public static TransferPayload from(Map<String, Object> payload) throws X402Exception {
        TransferPayload p;
        try {
            p = Json.MAPPER.convertValue(payload, TransferPayload.class);
        } catch (IllegalArgumentException e) {
            throw X402Exception.invalidPayload("malformed transfer payload", e);
        }
        if (p == null || p.txHash == null || !p.txHash.matches("0x[0-9a-fA-F]{8,128}")) {
            throw X402Exception.invalidPayload("transfer payload has no valid txHash");
        }
        if (p.submittedAt <= 0) {
            throw X402Exception.invalidPayload("transfer payload has no submittedAt");
        }
        if (p.submittedAt > ServerScheme.MAX_EPOCH_SECOND) {
            throw X402Exception.invalidPayload("submittedAt is out of range: " + p.submittedAt);
        }
        return p;
    }
}
