package com.github.mwbot.api;

import java.io.IOException;

import org.json.JSONObject;

/**
 * Error reported by the remote API. The code is meant for programmatic branching,
 * the response and request are kept for diagnostics.
 */
public class MwApiException extends IOException {
    private static final long serialVersionUID = 4203847261635508124L;

    private final String code;
    private final String info;
    private final transient Object response;
    private final transient ApiRequest request;

    public MwApiException(String code, String info, Object response, ApiRequest request) {
        super(code + ": " + info);
        this.code = code;
        this.info = info;
        this.response = response;
        this.request = request;
    }

    public String getCode() {
        return code;
    }

    public String getInfo() {
        return info;
    }

    /**
     * @return the decoded response, a {@link JSONObject} unless the body was malformed
     */
    public Object getResponse() {
        return response;
    }

    public ApiRequest getRequest() {
        return request;
    }

    public static MwApiException fromErrorResponse(JSONObject response, ApiRequest request) {
        var error = response.getJSONObject("error");
        return new MwApiException(error.optString("code"), error.optString("info"), response, request);
    }
}
