package io.paywire.x402.client.challenge;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.paywire.x402.model.PaymentRequired;
import io.paywire.x402.util.Json;

import java.net.http.HttpHeaders;

/** The canonical encoding: a {@link PaymentRequired} JSON body. */
public class JsonBodyChallengeParser implements ChallengeParserStrategy {

    @Override
    public String name() {
        return "json-body";
    }

    @Override
    public ParseResult parse(HttpHeaders headers, String body) {
        if (body == null || body.isBlank()) {
            return ParseResult.failure("empty body");
        }
        PaymentRequired pr;
        try {
            pr = Json.MAPPER.readValue(body, PaymentRequired.class);
        } catch (JsonProcessingException e) {
            return ParseResult.failure("body is not a payment challenge: " + e.getOriginalMessage());
        }
        if (!pr.isWellFormed()) {
            return ParseResult.failure("body has no x402Version or accepts");
        }
        return ParseResult.success(pr, name());
    }
}
