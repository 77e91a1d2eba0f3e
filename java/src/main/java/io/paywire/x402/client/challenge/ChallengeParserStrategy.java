package io.paywire.x402.client.challenge;

import java.net.http.HttpHeaders;

/** One encoding of a 402 challenge. Strategies never throw; they report failure in the result. */
public interface ChallengeParserStrategy {

    String name();

    ParseResult parse(HttpHeaders headers, String body);
}
