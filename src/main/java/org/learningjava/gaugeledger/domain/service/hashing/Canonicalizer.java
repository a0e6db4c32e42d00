package org.learningjava.gaugeledger.domain.service.hashing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Key-sorted form of JSON-like trees, so that two configurations which only differ in key order
 * serialize to the same text.
 * <p>
 * Accepted shapes: {@code null}, {@link String}, {@link Number}, {@link Boolean}, {@link Character},
 * enums, {@code Map<String, ?>}, {@link List} and object arrays. Maps come back as sorted maps,
 * sequences keep their order. Anything else (sets, arbitrary beans, non-string keys) is rejected.
 */
public final class Canonicalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Canonicalizer() {
    }

    public static Object canonicalize(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Only string keys can be canonicalized, got: "
                            + (entry.getKey() == null ? "null" : entry.getKey().getClass().getName()));
                }
                sorted.put(key, canonicalize(entry.getValue()));
            }
            return Collections.unmodifiableSortedMap(sorted);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(canonicalize(item));
            }
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Object[] array) {
            return canonicalize(Arrays.asList(array));
        }
        throw new IllegalArgumentException("Unsupported value for canonicalization: " + value.getClass().getName());
    }

    /** Canonical JSON text of {@code value}. */
    public static String toCanonicalJson(Object value) {
        try {
            return MAPPER.writeValueAsString(canonicalize(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
