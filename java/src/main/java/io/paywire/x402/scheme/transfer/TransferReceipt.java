package io.paywire.x402.scheme.transfer;

import java.math.BigInteger;
import java.util.List;

/** Mined transaction as reported by a {@link ChainReader}. */
public class TransferReceipt {

    private final String txHash;
    private final long blockNumber;
    private final boolean success;
    private final long blockTimestamp;
    private final List<TokenTransfer> transfers;

    public TransferReceipt(String txHash, long blockNumber, boolean success, long blockTimestamp,
                           List<TokenTransfer> transfers) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.success = success;
        this.blockTimestamp = blockTimestamp;
        this.transfers = List.copyOf(transfers);
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public boolean isSuccess() {
        return success;
    }

    /** Epoch seconds of the containing block. */
    public long getBlockTimestamp() {
        return blockTimestamp;
    }

    public List<TokenTransfer> getTransfers() {
        return transfers;
    }

    /** One token movement decoded from the receipt logs. */
    public static class TokenTransfer {
        private final String token;
        private final String from;
        private final String to;
        private final BigInteger value;

        public TokenTransfer(String token, String from, String to, BigInteger value) {
            this.token = token;
            this.from = from;
            this.to = to;
            this.value = value;
        }

        public String getToken() {
            return token;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        public BigInteger getValue() {
            return value;
        }
    }
}
