package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.HashMap;
import java.util.Map;

/**
 * Actionable guidance attached to a failed payment, telling the client what
 * to do next.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Remediation {
    public static final String RETRY = "retry";
    public static final String SIGN_NEW_PAYMENT = "sign_new_payment";
    public static final String SWITCH_NETWORK = "switch_network";
    public static final String RETRY_LATER = "retry_later";

    /** Suggested action, one of the constants above. */
    public String action;

    /** Why this action would help. */
    public String reason;

    /** Action-specific parameters. */
    private Map<String, Object> extra = new HashMap<>();

    /** Default constructor for Jackson. */
    public Remediation() {}

    public Remediation(String action, String reason) {
        this.action = action;
        this.reason = reason;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void setExtra(String key, Object value) {
        this.extra.put(key, value);
    }
}
