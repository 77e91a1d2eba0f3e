package io.paywire.x402.server;

import io.paywire.x402.server.pricing.PriceCalculator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A paid route: which paths and methods it covers and what it accepts as
 * payment, in order of preference.
 */
public class RouteConfig {
    private final String pathPattern;
    private final Pattern regex;
    private final Set<String> methods = new LinkedHashSet<>();
    private final List<AcceptOption> accepts;
    private PriceCalculator priceCalculator;
    private String description = "";
    private String mimeType = "application/json";

    /**
     * @param pathPattern path with {@code *} wildcards, e.g. {@code /api/premium/*}
     * @param accepts at least one accepted payment option
     */
    public RouteConfig(String pathPattern, AcceptOption... accepts) {
        this(pathPattern, Arrays.asList(accepts));
    }

    public RouteConfig(String pathPattern, List<AcceptOption> accepts) {
        if (pathPattern == null || pathPattern.isEmpty()) {
            throw new IllegalArgumentException("path pattern is required");
        }
        if (accepts == null || accepts.isEmpty()) {
            throw new IllegalArgumentException("route " + pathPattern + " accepts no payment option");
        }
        this.pathPattern = pathPattern;
        this.regex = compile(pathPattern);
        this.accepts = new ArrayList<>(accepts);
    }

    /** Restricts the route to the given HTTP methods; none means all methods. */
    public RouteConfig methods(String... methods) {
        for (String m : methods) {
            this.methods.add(m.toUpperCase(Locale.ROOT));
        }
        return this;
    }

    public RouteConfig priceCalculator(PriceCalculator priceCalculator) {
        this.priceCalculator = priceCalculator;
        return this;
    }

    public RouteConfig description(String description) {
        this.description = description;
        return this;
    }

    public RouteConfig mimeType(String mimeType) {
        this.mimeType = mimeType;
        return this;
    }

    public boolean matches(String method, String path) {
        if (!methods.isEmpty() && (method == null || !methods.contains(method.toUpperCase(Locale.ROOT)))) {
            return false;
        }
        return path != null && regex.matcher(path).matches();
    }

    public String pathPattern() {
        return pathPattern;
    }

    public Set<String> methods() {
        return methods;
    }

    public List<AcceptOption> accepts() {
        return accepts;
    }

    public PriceCalculator priceCalculator() {
        return priceCalculator;
    }

    public String description() {
        return description;
    }

    public String mimeType() {
        return mimeType;
    }

    static Pattern compile(String pattern) {
        String[] parts = pattern.split("\\*", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(".*");
            }
            if (!parts[i].isEmpty()) {
                sb.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile(sb.toString());
    }
}
