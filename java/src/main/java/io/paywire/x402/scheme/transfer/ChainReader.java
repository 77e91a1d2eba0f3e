package io.paywire.x402.scheme.transfer;

import java.io.IOException;
import java.util.Optional;

/**
 * Read access to a chain's RPC. The library does not depend on a chain SDK;
 * the host application injects an implementation.
 */
public interface ChainReader {

    /** @return empty if the transaction is unknown or not yet mined */
    Optional<TransferReceipt> receipt(String network, String txHash) throws IOException, InterruptedException;

    long latestBlock(String network) throws IOException, InterruptedException;
}
