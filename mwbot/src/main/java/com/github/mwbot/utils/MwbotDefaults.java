package com.github.mwbot.utils;

import java.time.Duration;

public final class MwbotDefaults {
    private MwbotDefaults() {}

    public static final String USER_AGENT = "mwbot";
    public static final String HTTP_METHOD = "POST";
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);

    public static final String FORMAT = "json";
    public static final String FORMAT_VERSION = "2";
    public static final int MAXLAG_S = 5;

    public static final Duration MAXLAG_PAUSE = Duration.ofSeconds(5);
    public static final int MAXLAG_MAX_RETRIES = 3;
    public static final int BADTOKEN_MAX_RETRIES = 2;

    public static final int HIGH_LIMIT_BATCH_SIZE = 500;
    public static final int LOW_LIMIT_BATCH_SIZE = 50;

    public static final int BATCH_CONCURRENCY = 5;
    public static final Duration SERIES_DELAY = Duration.ofSeconds(5);
    public static final int CONTINUED_QUERY_LIMIT = 10;

    // initial token, guaranteed to be rejected so that the first privileged call fetches a real one
    public static final String NO_TOKEN = "%notoken%";
}
