package io.paywire.x402.facilitator;

import java.util.ArrayList;
import java.util.List;

/** JSON returned by GET /supported. */
public class SupportedResponse {
    public List<Kind> kinds = new ArrayList<>();

    /** Default constructor for Jackson. */
    public SupportedResponse() {}

    public SupportedResponse(List<Kind> kinds) {
        this.kinds = new ArrayList<>(kinds);
    }
}
