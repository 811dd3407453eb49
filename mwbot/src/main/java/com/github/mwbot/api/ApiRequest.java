package com.github.mwbot.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical API request: the encoded form parameters, the transport options and the
 * number of maxlag retries spent so far. Re-issuing the request after a recoverable error
 * creates a new instance with the same parameters.
 */
public final class ApiRequest {
    private final Map<String, String> form;
    private final RequestOptions options;
    private final int retryNumber;

    public ApiRequest(Map<String, String> form, RequestOptions options) {
        this(form, options, 0);
    }

    private ApiRequest(Map<String, String> form, RequestOptions options, int retryNumber) {
        this.form = Collections.unmodifiableMap(new LinkedHashMap<>(form));
        this.options = Objects.requireNonNull(options);
        this.retryNumber = retryNumber;
    }

    public Map<String, String> getForm() {
        return form;
    }

    public RequestOptions getOptions() {
        return options;
    }

    public int getRetryNumber() {
        return retryNumber;
    }

    public ApiRequest withToken(String token) {
        var map = new LinkedHashMap<>(form);
        map.put("token", Objects.requireNonNull(token));
        return new ApiRequest(map, options, retryNumber);
    }

    public ApiRequest nextRetry() {
        return new ApiRequest(form, options, retryNumber + 1);
    }

    @Override
    public String toString() {
        var safe = new LinkedHashMap<>(form);
        safe.computeIfPresent("lgpassword", (k, v) -> "***");
        return String.format("[%s %s, form=%s, retry=%d]", options.getMethod(), options.getUri(), safe, retryNumber);
    }
}
