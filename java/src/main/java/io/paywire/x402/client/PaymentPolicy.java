package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;

import java.net.URI;
import java.util.List;

/** Narrows the candidate requirements before selection, e.g. to enforce a spending cap. */
@FunctionalInterface
public interface PaymentPolicy {
    List<PaymentRequirements> apply(List<PaymentRequirements> candidates);

    /** Same as {@link #apply(List)} for policies that do not care which resource is being paid for. */
    default List<PaymentRequirements> apply(List<PaymentRequirements> candidates, URI resource) {
        return apply(candidates);
    }

    /** Called after {@code resource} accepted a payment made under {@code paid}. */
    default void paid(PaymentRequirements paid, URI resource) {
    }
}
