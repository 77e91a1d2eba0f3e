package io.paywire.x402.client;

import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;

import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one negotiated request. Failures are reported here rather than
 * thrown so callers can branch on {@link #failure()}.
 */
public class PaymentResult {
    private final List<NegotiationState> transitions = new ArrayList<>();
    private HttpResponse<String> response;
    private PaymentRequired challenge;
    private PaymentRequirements selected;
    private PaymentPayload payment;
    private SettlementResult settlement;
    private ErrorKind failure;
    private String error;

    PaymentResult() {
        transitions.add(NegotiationState.UNPAID);
    }

    void enter(NegotiationState state) {
        transitions.add(state);
    }

    PaymentResult fail(ErrorKind kind, String message) {
        this.failure = kind;
        this.error = message;
        enter(NegotiationState.FAILED);
        return this;
    }

    void response(HttpResponse<String> response) {
        this.response = response;
    }

    void challenge(PaymentRequired challenge) {
        this.challenge = challenge;
    }

    void selected(PaymentRequirements selected) {
        this.selected = selected;
    }

    void payment(PaymentPayload payment) {
        this.payment = payment;
    }

    void settlement(SettlementResult settlement) {
        this.settlement = settlement;
    }

    /** Current state; {@code UNPAID} when the resource did not ask for payment. */
    public NegotiationState state() {
        return transitions.get(transitions.size() - 1);
    }

    /** Every state entered, in order. */
    public List<NegotiationState> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    public boolean paid() {
        return state() == NegotiationState.SETTLED;
    }

    public boolean failed() {
        return state() == NegotiationState.FAILED;
    }

    /** Last response received, or null if the engine gave up before retrying. */
    public HttpResponse<String> response() {
        return response;
    }

    public PaymentRequired challenge() {
        return challenge;
    }

    public PaymentRequirements selected() {
        return selected;
    }

    public PaymentPayload payment() {
        return payment;
    }

    /** Decoded receipt header, if the server sent one. */
    public SettlementResult settlement() {
        return settlement;
    }

    public ErrorKind failure() {
        return failure;
    }

    public String error() {
        return error;
    }
}
