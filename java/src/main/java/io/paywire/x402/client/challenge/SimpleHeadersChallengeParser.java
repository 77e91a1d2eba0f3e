package io.paywire.x402.client.challenge;

import io.paywire.x402.X402;

import java.net.http.HttpHeaders;

/**
 * Separate {@code X-Price} (atomic units) and {@code X-Recipient} headers, with
 * optional {@code X-Token} and {@code X-Chain}. Network and asset fall back to
 * the defaults given at construction.
 */
public class SimpleHeadersChallengeParser implements ChallengeParserStrategy {
    private final String defaultNetwork;
    private final String defaultAsset;

    public SimpleHeadersChallengeParser() {
        this(null, null);
    }

    public SimpleHeadersChallengeParser(String defaultNetwork, String defaultAsset) {
        this.defaultNetwork = defaultNetwork;
        this.defaultAsset = defaultAsset;
    }

    @Override
    public String name() {
        return "price-headers";
    }

    @Override
    public ParseResult parse(HttpHeaders headers, String body) {
        String price = headers.firstValue(X402.PRICE_HEADER).map(String::trim).orElse(null);
        String recipient = headers.firstValue(X402.RECIPIENT_HEADER).map(String::trim).orElse(null);
        if (price == null || recipient == null) {
            return ParseResult.failure("no " + X402.PRICE_HEADER + "/" + X402.RECIPIENT_HEADER + " headers");
        }
        if (!HeaderChallenges.isAtomic(price)) {
            return ParseResult.failure(X402.PRICE_HEADER + " is not an atomic amount: " + price);
        }
        String network = headers.firstValue(X402.CHAIN_HEADER).map(String::trim).orElse(defaultNetwork);
        String asset = headers.firstValue(X402.TOKEN_HEADER).map(String::trim).orElse(defaultAsset);
        if (network == null || asset == null) {
            return ParseResult.failure("no " + X402.CHAIN_HEADER + " or " + X402.TOKEN_HEADER + " and no default");
        }
        return ParseResult.success(HeaderChallenges.single(null, network, asset, price, recipient, null, null), name());
    }
}
