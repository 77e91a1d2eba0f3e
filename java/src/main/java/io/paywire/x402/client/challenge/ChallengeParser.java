package io.paywire.x402.client.challenge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a 402 challenge by trying each strategy in order; the first success
 * wins. The default order is the JSON body, {@code X-Payment-Required},
 * {@code WWW-Authenticate}, and finally the separate {@code X-Price} headers.
 */
public class ChallengeParser {
    private static final Logger log = LoggerFactory.getLogger(ChallengeParser.class);

    private final List<ChallengeParserStrategy> strategies;

    public ChallengeParser(List<ChallengeParserStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one challenge parser strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static ChallengeParser defaults() {
        return new ChallengeParser(Arrays.asList(
                new JsonBodyChallengeParser(),
                new PaymentRequiredHeaderParser(),
                new WwwAuthenticateChallengeParser(),
                new SimpleHeadersChallengeParser()));
    }

    public ParseResult parse(HttpHeaders headers, String body) {
        List<String> failures = new ArrayList<>();
        for (ChallengeParserStrategy s : strategies) {
            ParseResult r = s.parse(headers, body);
            if (r.isSuccess()) {
                log.debug("x402 challenge parsed by {}", s.name());
                return r;
            }
            failures.add(s.name() + ": " + r.failure());
        }
        return ParseResult.failure("no readable payment challenge (" + String.join("; ", failures) + ")");
    }

    public List<ChallengeParserStrategy> strategies() {
        return strategies;
    }
}
