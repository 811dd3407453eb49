package com.github.mwbot.api;

public class InvalidResponseException extends MwApiException {
    private static final long serialVersionUID = -1958337305870290432L;

    public static final String CODE = "invalidjson";

    public InvalidResponseException(Object body, ApiRequest request) {
        super(CODE, "No valid JSON response", body, request);
    }
}
