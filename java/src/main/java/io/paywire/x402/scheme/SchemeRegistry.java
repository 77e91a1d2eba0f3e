package io.paywire.x402.scheme;

import io.paywire.x402.error.X402Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps {@code (role, scheme id, network pattern)} to registered {@link Scheme}
 * instances. Lookups pick the most specific pattern matching the exact network,
 * so {@code eip155:8453} beats {@code eip155:*}, which beats {@code *}.
 *
 * <p>Registering a second scheme under the same role, id and pattern replaces
 * the first. The registry is safe to read from request threads while it is
 * being populated.</p>
 */
public class SchemeRegistry {
    private static final Logger log = LoggerFactory.getLogger(SchemeRegistry.class);

    private final Map<Key, Scheme> schemes = new ConcurrentHashMap<>();

    /**
     * Registers {@code scheme} for every network matching {@code networkPattern}.
     *
     * @return this registry, for chaining
     * @throws IllegalArgumentException if the pattern is not CAIP-2 or a wildcard
     */
    public SchemeRegistry register(String networkPattern, Scheme scheme) {
        Objects.requireNonNull(scheme, "scheme");
        NetworkPattern pattern = NetworkPattern.parse(networkPattern);
        Key key = new Key(scheme.role(), scheme.schemeId(), pattern);
        Scheme previous = schemes.put(key, scheme);
        if (previous != null && previous != scheme) {
            log.debug("x402 {} scheme '{}' for {} replaced", scheme.role(), scheme.schemeId(), pattern);
        }
        return this;
    }

    /** Most specific scheme of {@code type} registered for the exact {@code network}. */
    public <S extends Scheme> Optional<S> resolve(SchemeRole role, String schemeId, String network,
                                                  Class<S> type) {
        if (schemeId == null || network == null) {
            return Optional.empty();
        }
        return schemes.entrySet().stream()
                .filter(e -> e.getKey().role == role
                        && e.getKey().schemeId.equals(schemeId)
                        && e.getKey().pattern.matches(network))
                .max(Comparator.comparingInt(e -> e.getKey().pattern.specificity()))
                .map(Map.Entry::getValue)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /**
     * Like {@link #resolve} but reports a missing scheme as a typed failure.
     *
     * @throws X402Exception with {@code NO_MATCHING_SCHEME}
     */
    public <S extends Scheme> S require(SchemeRole role, String schemeId, String network, Class<S> type)
            throws X402Exception {
        return resolve(role, schemeId, network, type).orElseThrow(() -> X402Exception.noMatchingScheme(
                "no " + role.name().toLowerCase() + " scheme '" + schemeId + "' registered for " + network));
    }

    public Optional<ClientScheme> resolveClient(String schemeId, String network) {
        return resolve(SchemeRole.CLIENT, schemeId, network, ClientScheme.class);
    }

    public Optional<ServerScheme> resolveServer(String schemeId, String network) {
        return resolve(SchemeRole.SERVER, schemeId, network, ServerScheme.class);
    }

    public Optional<FacilitatorScheme> resolveFacilitator(String schemeId, String network) {
        return resolve(SchemeRole.FACILITATOR, schemeId, network, FacilitatorScheme.class);
    }

    public boolean supports(SchemeRole role, String schemeId, String network) {
        return resolve(role, schemeId, network, Scheme.class).isPresent();
    }

    /** Registered {@code (scheme id, pattern)} pairs for one role, most specific first. */
    public List<Registration> registrations(SchemeRole role) {
        List<Registration> out = new ArrayList<>();
        for (Key key : schemes.keySet()) {
            if (key.role == role) {
                out.add(new Registration(key.schemeId, key.pattern));
            }
        }
        out.sort(Comparator.comparingInt((Registration r) -> -r.pattern.specificity())
                .thenComparing(r -> r.schemeId)
                .thenComparing(r -> r.pattern.toString()));
        return out;
    }

    /** One registered scheme id and the network pattern it was registered under. */
    public static final class Registration {
        public final String schemeId;
        public final NetworkPattern pattern;

        Registration(String schemeId, NetworkPattern pattern) {
            this.schemeId = schemeId;
            this.pattern = pattern;
        }
    }

    private static final class Key {
        final SchemeRole role;
        final String schemeId;
        final NetworkPattern pattern;

        Key(SchemeRole role, String schemeId, NetworkPattern pattern) {
            this.role = Objects.requireNonNull(role);
            this.schemeId = Objects.requireNonNull(schemeId);
            this.pattern = pattern;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) {
                return false;
            }
            Key k = (Key) o;
            return role == k.role && schemeId.equals(k.schemeId) && pattern.equals(k.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(role, schemeId, pattern);
        }
    }
}
