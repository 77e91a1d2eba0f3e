package io.paywire.x402.config;

import io.paywire.x402.X402;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by a resource server and a paying client. Built once at
 * startup and handed to the components that need it.
 */
public final class X402Config {

    public static final String PREFIX = "x402.";

    private final String walletAddress;
    private final VerificationMode verificationMode;
    private final String facilitatorUrl;
    private final Duration facilitatorTimeout;
    private final String facilitatorApiKey;
    private final String defaultNetwork;
    private final String defaultAsset;
    private final int defaultMaxTimeoutSeconds;
    private final Duration nonceTtl;
    private final String paymentHeader;

    private X402Config(Builder b) {
        this.walletAddress = b.walletAddress;
        this.verificationMode = Objects.requireNonNull(b.verificationMode, "verificationMode");
        this.facilitatorUrl = b.facilitatorUrl;
        this.facilitatorTimeout = Objects.requireNonNull(b.facilitatorTimeout, "facilitatorTimeout");
        this.facilitatorApiKey = b.facilitatorApiKey;
        this.defaultNetwork = b.defaultNetwork;
        this.defaultAsset = b.defaultAsset;
        this.defaultMaxTimeoutSeconds = b.defaultMaxTimeoutSeconds;
        this.nonceTtl = Objects.requireNonNull(b.nonceTtl, "nonceTtl");
        this.paymentHeader = Objects.requireNonNull(b.paymentHeader, "paymentHeader");
        if (defaultMaxTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("default-max-timeout-seconds must be positive");
        }
        if (verificationMode == VerificationMode.FACILITATOR && (facilitatorUrl == null || facilitatorUrl.isBlank())) {
            throw new IllegalArgumentException("facilitator-url is required in facilitator verification mode");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code x402.*} keys, e.g. {@code x402.wallet-address}. Missing keys keep
     * their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static X402Config fromProperties(Properties props) {
        Builder b = builder();
        String v;
        if ((v = get(props, "wallet-address")) != null) {
            b.walletAddress(v);
        }
        if ((v = get(props, "verification-mode")) != null) {
            b.verificationMode(VerificationMode.fromKey(v));
        }
        if ((v = get(props, "facilitator-url")) != null) {
            b.facilitatorUrl(v);
        }
        if ((v = get(props, "facilitator-timeout-seconds")) != null) {
            b.facilitatorTimeout(Duration.ofSeconds(parseLong("facilitator-timeout-seconds", v)));
        }
        if ((v = get(props, "facilitator-api-key")) != null) {
            b.facilitatorApiKey(v);
        }
        if ((v = get(props, "default-network")) != null) {
            b.defaultNetwork(v);
        }
        if ((v = get(props, "default-asset")) != null) {
            b.defaultAsset(v);
        }
        if ((v = get(props, "default-max-timeout-seconds")) != null) {
            b.defaultMaxTimeoutSeconds((int) parseLong("default-max-timeout-seconds", v));
        }
        if ((v = get(props, "nonce-ttl-seconds")) != null) {
            b.nonceTtl(Duration.ofSeconds(parseLong("nonce-ttl-seconds", v)));
        }
        if ((v = get(props, "payment-header")) != null) {
            b.paymentHeader(v);
        }
        return b.build();
    }

    private static String get(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("x402." + key + " is not a number: " + value, e);
        }
    }

    /** Default payee for routes whose accept options do not name one. */
    public String walletAddress() {
        return walletAddress;
    }

    public VerificationMode verificationMode() {
        return verificationMode;
    }

    public String facilitatorUrl() {
        return facilitatorUrl;
    }

    public Duration facilitatorTimeout() {
        return facilitatorTimeout;
    }

    public String facilitatorApiKey() {
        return facilitatorApiKey;
    }

    public String defaultNetwork() {
        return defaultNetwork;
    }

    public String defaultAsset() {
        return defaultAsset;
    }

    public int defaultMaxTimeoutSeconds() {
        return defaultMaxTimeoutSeconds;
    }

    /** Minimum time a consumed proof is remembered. */
    public Duration nonceTtl() {
        return nonceTtl;
    }

    /** Request header carrying the payment, normally {@code X-PAYMENT}. */
    public String paymentHeader() {
        return paymentHeader;
    }

    public static final class Builder {
        private String walletAddress;
        private VerificationMode verificationMode = VerificationMode.ON_CHAIN;
        private String facilitatorUrl;
        private Duration facilitatorTimeout = Duration.ofSeconds(30);
        private String facilitatorApiKey;
        private String defaultNetwork = "eip155:8453";
        private String defaultAsset;
        private int defaultMaxTimeoutSeconds = X402.DEFAULT_MAX_TIMEOUT_SECONDS;
        private Duration nonceTtl = Duration.ofHours(1);
        private String paymentHeader = X402.PAYMENT_HEADER;

        private Builder() {}

        public Builder walletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
            return this;
        }

        public Builder verificationMode(VerificationMode verificationMode) {
            this.verificationMode = verificationMode;
            return this;
        }

        /** Required when the mode is {@link VerificationMode#FACILITATOR}. */
        public Builder facilitatorUrl(String facilitatorUrl) {
            this.facilitatorUrl = facilitatorUrl;
            return this;
        }

        public Builder facilitatorTimeout(Duration facilitatorTimeout) {
            this.facilitatorTimeout = facilitatorTimeout;
            return this;
        }

        public Builder facilitatorApiKey(String facilitatorApiKey) {
            this.facilitatorApiKey = facilitatorApiKey;
            return this;
        }

        public Builder defaultNetwork(String defaultNetwork) {
            this.defaultNetwork = defaultNetwork;
            return this;
        }

        public Builder defaultAsset(String defaultAsset) {
            this.defaultAsset = defaultAsset;
            return this;
        }

        public Builder defaultMaxTimeoutSeconds(int defaultMaxTimeoutSeconds) {
            this.defaultMaxTimeoutSeconds = defaultMaxTimeoutSeconds;
            return this;
        }

        public Builder nonceTtl(Duration nonceTtl) {
            this.nonceTtl = nonceTtl;
            return this;
        }

        public Builder paymentHeader(String paymentHeader) {
            this.paymentHeader = paymentHeader;
            return this;
        }

        /** @throws IllegalArgumentException if the settings are inconsistent */
        public X402Config build() {
            return new X402Config(this);
        }
    }
}
