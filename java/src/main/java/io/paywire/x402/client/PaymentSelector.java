package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;

import java.util.List;
import java.util.Optional;

/** Picks one entry from the mutually supported requirements, which keep the server's order. */
@FunctionalInterface
public interface PaymentSelector {
    Optional<PaymentRequirements> select(List<PaymentRequirements> candidates);
}
