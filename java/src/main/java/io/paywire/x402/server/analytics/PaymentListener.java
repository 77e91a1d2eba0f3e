package io.paywire.x402.server.analytics;

/** Told about every payment a resource server accepts, after settlement. */
@FunctionalInterface
public interface PaymentListener {
    void onPayment(PaymentRecord record);
}
