package com.github.mwbot.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.lang3.ArrayUtils;
import org.json.JSONArray;

/**
 * Converts loosely typed API parameters into the string form the remote service expects.
 */
public final class ParameterEncoder {
    public static final char UNIT_SEPARATOR = '\u001f';

    private ParameterEncoder() {}

    /**
     * Normalizes a parameter map:
     * <ul>
     * <li>sequences (collections, arrays, JSON arrays) are joined with {@code |}, unless an
     * element already contains a pipe; in that case every element is preceded by U+001F</li>
     * <li>{@code false} and {@code null} values are dropped</li>
     * <li>{@code true} becomes {@code "1"}, anything else goes through {@link String#valueOf(Object)}</li>
     * </ul>
     *
     * @param params raw parameters, iteration order is preserved
     * @return an unmodifiable map of encoded parameters
     */
    public static Map<String, String> preprocess(Map<String, ?> params) {
        var out = new LinkedHashMap<String, String>();

        params.forEach((key, value) -> {
            if (value == null || Boolean.FALSE.equals(value)) {
                return;
            }

            if (Boolean.TRUE.equals(value)) {
                out.put(key, "1");
            } else if (isSequence(value)) {
                out.put(key, joinValues(asList(value)));
            } else {
                out.put(key, String.valueOf(value));
            }
        });

        return Collections.unmodifiableMap(out);
    }

    public static String joinValues(List<?> values) {
        var strings = values.stream().map(String::valueOf).toList();

        if (strings.stream().noneMatch(s -> s.indexOf('|') != -1)) {
            return String.join("|", strings);
        } else {
            return UNIT_SEPARATOR + String.join(String.valueOf(UNIT_SEPARATOR), strings);
        }
    }

    public static boolean isSequence(Object value) {
        return value instanceof Collection || value instanceof JSONArray ||
            (value != null && value.getClass().isArray());
    }

    public static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        } else if (value instanceof Collection<?> coll) {
            return List.copyOf(coll);
        } else if (value instanceof JSONArray arr) {
            return arr.toList();
        } else if (value instanceof Object[] arr) {
            return Arrays.asList(arr);
        } else if (value instanceof int[] arr) {
            return Arrays.asList(ArrayUtils.toObject(arr));
        } else if (value instanceof long[] arr) {
            return Arrays.asList(ArrayUtils.toObject(arr));
        } else {
            throw new IllegalArgumentException("Not a sequence: " + value);
        }
    }

    public static String urlEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" +
                URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
