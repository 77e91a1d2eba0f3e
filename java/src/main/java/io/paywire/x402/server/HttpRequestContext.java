package io.paywire.x402.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/** Framework-neutral view of an inbound request. Header lookups ignore case. */
public class HttpRequestContext {
    private final String method;
    private final String path;
    private final String url;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final String remoteAddress;
    private final long bodySize;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public HttpRequestContext(String method, String path, String url, Map<String, String> headers,
                              String remoteAddress, long bodySize) {
        this.method = method;
        this.path = path;
        this.url = url != null ? url : path;
        if (headers != null) {
            this.headers.putAll(headers);
        }
        this.remoteAddress = remoteAddress;
        this.bodySize = Math.max(0, bodySize);
    }

    public static HttpRequestContext of(String method, String path) {
        return new HttpRequestContext(method, path, path, Collections.emptyMap(), null, 0);
    }

    public HttpRequestContext header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /** Adds an entry visible to price calculators. */
    public HttpRequestContext metadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public String url() {
        return url;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public long bodySize() {
        return bodySize;
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /** First {@code X-Forwarded-For} hop, then {@code X-Real-IP}, then the socket address. */
    public String clientIp() {
        String forwarded = headers.get("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = headers.get("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return remoteAddress;
    }
}
