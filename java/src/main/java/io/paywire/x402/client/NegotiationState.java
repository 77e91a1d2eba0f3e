package io.paywire.x402.client;

/** Client-side negotiation states, in the order a successful payment passes them. */
public enum NegotiationState {
    UNPAID,
    CHALLENGED,
    SELECTING,
    SIGNING,
    RETRYING,
    SETTLED,
    FAILED;

    public boolean isTerminal() {
        return this == SETTLED || this == FAILED;
    }
}
