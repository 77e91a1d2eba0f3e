package io.paywire.x402.client.challenge;

import io.paywire.x402.X402;
import io.paywire.x402.util.AuthParams;

import java.net.http.HttpHeaders;
import java.util.Map;

/**
 * {@code WWW-Authenticate: x402 amount=10000 recipient=0x.. token=0x.. chain=eip155:8453}.
 * {@code scheme}, {@code timeout} and {@code description} are optional.
 */
public class WwwAuthenticateChallengeParser implements ChallengeParserStrategy {

    @Override
    public String name() {
        return "www-authenticate";
    }

    @Override
    public ParseResult parse(HttpHeaders headers, String body) {
        for (String value : headers.allValues(X402.WWW_AUTHENTICATE_HEADER)) {
            String v = value.trim();
            if (v.length() <= X402.AUTH_SCHEME.length()
                    || !v.regionMatches(true, 0, X402.AUTH_SCHEME, 0, X402.AUTH_SCHEME.length())
                    || !Character.isWhitespace(v.charAt(X402.AUTH_SCHEME.length()))) {
                continue;
            }
            Map<String, String> p = AuthParams.parse(v.substring(X402.AUTH_SCHEME.length()));
            String amount = p.get("amount");
            if (!HeaderChallenges.isAtomic(amount)) {
                return ParseResult.failure("x402 challenge has no valid amount: " + amount);
            }
            for (String required : new String[] {"recipient", "token", "chain"}) {
                if (p.get(required) == null) {
                    return ParseResult.failure("x402 challenge is missing " + required);
                }
            }
            Integer timeout = null;
            String t = p.get("timeout");
            if (t != null) {
                if (!t.matches("\\d{1,10}") || Long.parseLong(t) == 0 || Long.parseLong(t) > Integer.MAX_VALUE) {
                    return ParseResult.failure("x402 challenge has an invalid timeout: " + t);
                }
                timeout = Integer.valueOf(t);
            }
            return ParseResult.success(HeaderChallenges.single(p.get("scheme"), p.get("chain"), p.get("token"),
                    amount, p.get("recipient"), timeout, p.get("description")), name());
        }
        return ParseResult.failure("no x402 WWW-Authenticate challenge");
    }
}
