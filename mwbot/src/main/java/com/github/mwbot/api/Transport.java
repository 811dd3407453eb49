package com.github.mwbot.api;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a single network call. The returned future yields the decoded body, which
 * is a {@code JSONObject} or {@code JSONArray} for JSON payloads and the raw string
 * otherwise, or fails with an {@link java.io.IOException}. Implementations never retry.
 */
public interface Transport {
    CompletableFuture<Object> send(ApiRequest request);

    CallStatistics getStatistics();
}
