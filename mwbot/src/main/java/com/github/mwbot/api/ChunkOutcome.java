package com.github.mwbot.api;

import java.util.Objects;

import org.json.JSONObject;

/**
 * Result slot of one chunk of a split query: either the decoded response or the
 * error that chunk failed with.
 */
public final class ChunkOutcome {
    private final JSONObject response;
    private final Throwable error;

    private ChunkOutcome(JSONObject response, Throwable error) {
        this.response = response;
        this.error = error;
    }

    public static ChunkOutcome success(JSONObject response) {
        return new ChunkOutcome(Objects.requireNonNull(response), null);
    }

    public static ChunkOutcome failure(Throwable error) {
        return new ChunkOutcome(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public JSONObject getResponse() {
        return response;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "[success]" : String.format("[failure: %s]", error.getMessage());
    }
}
