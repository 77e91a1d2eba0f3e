package io.paywire.x402.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** Shared Jackson mapper plus the base64-JSON helpers used by the x402 headers. */
public final class Json {
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper SORTED = MAPPER.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Json() {}

    /** Serializes {@code value} to JSON and base64-encodes the UTF-8 bytes. */
    public static String toBase64(Object value) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(value);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes a header value that is either base64-encoded JSON or raw JSON.
     *
     * @throws IllegalArgumentException if the value is neither
     */
    public static <T> T fromBase64OrJson(String value, Class<T> type) {
        return fromTree(treeFromBase64OrJson(value, type.getSimpleName()), type);
    }

    /**
     * Like {@link #fromBase64OrJson} but stops at the JSON tree, keeping members
     * that no model class declares.
     *
     * @param what name used in error messages
     * @throws IllegalArgumentException if the value is neither base64 nor JSON
     */
    public static JsonNode treeFromBase64OrJson(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("empty " + what + " header");
        }
        String trimmed = value.trim();
        String json;
        if (trimmed.startsWith("{")) {
            json = trimmed;
        } else {
            try {
                json = new String(Base64.getDecoder().decode(trimmed), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("header is neither base64 nor JSON", e);
            }
        }
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("malformed " + what + " JSON", e);
        }
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            throw new IllegalArgumentException("empty " + what + " JSON");
        }
        return tree;
    }

    /** @throws IllegalArgumentException if {@code tree} does not bind to {@code type} */
    public static <T> T fromTree(JsonNode tree, Class<T> type) {
        if (!tree.isObject()) {
            throw new IllegalArgumentException("malformed " + type.getSimpleName() + " JSON: not an object");
        }
        try {
            return MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed " + type.getSimpleName() + " JSON", e);
        }
    }

    /**
     * Round-trips {@code value} through its JSON text so that trees built from
     * Java objects and trees parsed from the wire compare equal.
     */
    public static JsonNode canonicalTree(Object value) {
        try {
            return MAPPER.readTree(MAPPER.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to canonicalize " + value.getClass().getSimpleName(), e);
        }
    }

    /** Stable JSON text of {@code value} with map keys sorted. */
    public static String canonicalString(Object value) {
        try {
            return SORTED.writeValueAsString(MAPPER.treeToValue(canonicalTree(value), Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to canonicalize " + value.getClass().getSimpleName(), e);
        }
    }
}
