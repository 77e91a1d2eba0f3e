package io.paywire.x402.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats and parses {@code key=value} parameter lists as used by
 * {@code WWW-Authenticate: x402 amount=10000 recipient=0x.. description="..."}.
 */
public final class AuthParams {
    private static final Pattern PARAM = Pattern.compile("(\\w+)=(?:\"([^\"]*)\"|(\\S+))");

    private AuthParams() {}

    /** Parses the parameter list that follows the auth scheme token. */
    public static Map<String, String> parse(String params) {
        Map<String, String> out = new LinkedHashMap<>();
        if (params == null) {
            return out;
        }
        Matcher m = PARAM.matcher(params);
        while (m.find()) {
            out.put(m.group(1), m.group(2) != null ? m.group(2) : m.group(3));
        }
        return out;
    }

    /** Writes {@code scheme k=v k="v w"}; values containing whitespace or quotes are quoted. */
    public static String format(String scheme, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(scheme);
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getValue() == null) {
                continue;
            }
            String v = e.getValue().replace("\"", "'");
            sb.append(' ').append(e.getKey()).append('=');
            if (v.isEmpty() || v.chars().anyMatch(Character::isWhitespace)) {
                sb.append('"').append(v).append('"');
            } else {
                sb.append(v);
            }
        }
        return sb.toString();
    }
}
