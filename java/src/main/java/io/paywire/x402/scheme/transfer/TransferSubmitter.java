package io.paywire.x402.scheme.transfer;

import io.paywire.x402.model.PaymentRequirements;

import java.io.IOException;

/** Client-side wallet hook: sends {@code amount} of {@code asset} to {@code payTo} and returns the tx hash. */
public interface TransferSubmitter {

    /** Address the transfer is sent from. */
    String address();

    String transfer(PaymentRequirements requirements) throws IOException, InterruptedException;
}
