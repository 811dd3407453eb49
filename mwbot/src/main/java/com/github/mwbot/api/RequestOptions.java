package com.github.mwbot.api;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.github.mwbot.utils.MwbotDefaults;

/**
 * Transport-level options of an API call: destination, HTTP method, headers,
 * query string and the default form parameters sent with every request.
 * <p>
 * Instances are immutable. Combining two instances with {@link #merge(RequestOptions)}
 * replaces scalar fields that are set on the argument and merges the header, query and
 * form maps one level deep, the argument's entries taking precedence. A {@code null}
 * form or query value survives the merge and is dropped later on, which is how a default
 * parameter gets unset for a single call.
 */
public final class RequestOptions {
    private static final RequestOptions EMPTY = new RequestOptions(null, null, null, Map.of(), Map.of(), Map.of());

    private final URI uri;
    private final String method;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final Map<String, Object> query;
    private final Map<String, Object> form;

    private RequestOptions(URI uri, String method, Duration timeout, Map<String, String> headers,
            Map<String, Object> query, Map<String, Object> form) {
        this.uri = uri;
        this.method = method;
        this.timeout = timeout;
        this.headers = headers;
        this.query = query;
        this.form = form;
    }

    public static RequestOptions empty() {
        return EMPTY;
    }

    public static RequestOptions defaults() {
        var form = new LinkedHashMap<String, Object>();
        form.put("format", MwbotDefaults.FORMAT);
        form.put("formatversion", MwbotDefaults.FORMAT_VERSION);
        form.put("maxlag", MwbotDefaults.MAXLAG_S);

        return new RequestOptions(null, MwbotDefaults.HTTP_METHOD, MwbotDefaults.REQUEST_TIMEOUT,
            Map.of("User-Agent", MwbotDefaults.USER_AGENT), Map.of(), Collections.unmodifiableMap(form));
    }

    public static RequestOptions get(URI uri) {
        return new RequestOptions(uri, "GET", null, Map.of(), Map.of(), Map.of());
    }

    public RequestOptions withUri(URI uri) {
        return new RequestOptions(uri, method, timeout, headers, query, form);
    }

    public RequestOptions withMethod(String method) {
        return new RequestOptions(uri, Objects.requireNonNull(method), timeout, headers, query, form);
    }

    public RequestOptions withTimeout(Duration timeout) {
        return new RequestOptions(uri, method, Objects.requireNonNull(timeout), headers, query, form);
    }

    public RequestOptions withHeader(String name, String value) {
        return new RequestOptions(uri, method, timeout, put(headers, name, value), query, form);
    }

    public RequestOptions withQueryParam(String name, Object value) {
        return new RequestOptions(uri, method, timeout, headers, put(query, name, value), form);
    }

    public RequestOptions withFormParam(String name, Object value) {
        return new RequestOptions(uri, method, timeout, headers, query, put(form, name, value));
    }

    public RequestOptions withFormParams(Map<String, ?> params) {
        return new RequestOptions(uri, method, timeout, headers, query, putAll(form, params));
    }

    public RequestOptions merge(RequestOptions overrides) {
        if (overrides == null || overrides == EMPTY) {
            return this;
        }

        return new RequestOptions(
            overrides.uri != null ? overrides.uri : uri,
            overrides.method != null ? overrides.method : method,
            overrides.timeout != null ? overrides.timeout : timeout,
            putAll(headers, overrides.headers),
            putAll(query, overrides.query),
            putAll(form, overrides.form)
        );
    }

    public URI getUri() {
        return uri;
    }

    public String getMethod() {
        return method != null ? method : MwbotDefaults.HTTP_METHOD;
    }

    public Duration getTimeout() {
        return timeout != null ? timeout : MwbotDefaults.REQUEST_TIMEOUT;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, Object> getQuery() {
        return query;
    }

    public Map<String, Object> getForm() {
        return form;
    }

    private static <V> Map<String, V> put(Map<String, V> base, String key, V value) {
        var map = new LinkedHashMap<>(base);
        map.put(Objects.requireNonNull(key), value);
        return Collections.unmodifiableMap(map);
    }

    private static <V> Map<String, V> putAll(Map<String, V> base, Map<String, ? extends V> overrides) {
        if (overrides.isEmpty()) {
            return base;
        }

        var map = new LinkedHashMap<String, V>(base);
        map.putAll(overrides);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return String.format("[%s %s, headers=%s, query=%s, form=%s]", getMethod(), uri, headers, query, form);
    }
}
