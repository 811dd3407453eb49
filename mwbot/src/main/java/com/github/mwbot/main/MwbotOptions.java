package com.github.mwbot.main;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import com.github.mwbot.utils.MwbotDefaults;

/**
 * Engine configuration. Unset fields fall back to {@link MwbotDefaults};
 * {@link #merge(MwbotOptions)} lets every field set on the argument win.
 */
public final class MwbotOptions {
    private final URI apiUrl;
    private final String username;
    private final String password;
    private final String userAgent;
    private final Boolean silent;
    private final Boolean hasApiHighLimit;
    private final Duration maxlagPause;
    private final Integer maxlagMaxRetries;
    private final Integer badtokenMaxRetries;
    private final Integer batchConcurrency;
    private final Duration seriesDelay;
    private final Integer continuedQueryLimit;

    private MwbotOptions(Builder b) {
        apiUrl = b.apiUrl;
        username = b.username;
        password = b.password;
        userAgent = b.userAgent;
        silent = b.silent;
        hasApiHighLimit = b.hasApiHighLimit;
        maxlagPause = b.maxlagPause;
        maxlagMaxRetries = b.maxlagMaxRetries;
        badtokenMaxRetries = b.badtokenMaxRetries;
        batchConcurrency = b.batchConcurrency;
        seriesDelay = b.seriesDelay;
        continuedQueryLimit = b.continuedQueryLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MwbotOptions defaults() {
        return builder().build();
    }

    public MwbotOptions merge(MwbotOptions o) {
        if (o == null) {
            return this;
        }

        var b = new Builder();
        b.apiUrl = o.apiUrl != null ? o.apiUrl : apiUrl;
        b.username = o.username != null ? o.username : username;
        b.password = o.password != null ? o.password : password;
        b.userAgent = o.userAgent != null ? o.userAgent : userAgent;
        b.silent = o.silent != null ? o.silent : silent;
        b.hasApiHighLimit = o.hasApiHighLimit != null ? o.hasApiHighLimit : hasApiHighLimit;
        b.maxlagPause = o.maxlagPause != null ? o.maxlagPause : maxlagPause;
        b.maxlagMaxRetries = o.maxlagMaxRetries != null ? o.maxlagMaxRetries : maxlagMaxRetries;
        b.badtokenMaxRetries = o.badtokenMaxRetries != null ? o.badtokenMaxRetries : badtokenMaxRetries;
        b.batchConcurrency = o.batchConcurrency != null ? o.batchConcurrency : batchConcurrency;
        b.seriesDelay = o.seriesDelay != null ? o.seriesDelay : seriesDelay;
        b.continuedQueryLimit = o.continuedQueryLimit != null ? o.continuedQueryLimit : continuedQueryLimit;
        return b.build();
    }

    public URI getApiUrl() {
        return apiUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getUserAgent() {
        return userAgent != null ? userAgent : MwbotDefaults.USER_AGENT;
    }

    public boolean isSilent() {
        return silent != null && silent;
    }

    public boolean hasApiHighLimit() {
        return hasApiHighLimit == null || hasApiHighLimit;
    }

    public int getBatchSize() {
        return hasApiHighLimit() ? MwbotDefaults.HIGH_LIMIT_BATCH_SIZE : MwbotDefaults.LOW_LIMIT_BATCH_SIZE;
    }

    public Duration getMaxlagPause() {
        return maxlagPause != null ? maxlagPause : MwbotDefaults.MAXLAG_PAUSE;
    }

    public int getMaxlagMaxRetries() {
        return maxlagMaxRetries != null ? maxlagMaxRetries : MwbotDefaults.MAXLAG_MAX_RETRIES;
    }

    public int getBadtokenMaxRetries() {
        return badtokenMaxRetries != null ? badtokenMaxRetries : MwbotDefaults.BADTOKEN_MAX_RETRIES;
    }

    public int getBatchConcurrency() {
        return batchConcurrency != null ? batchConcurrency : MwbotDefaults.BATCH_CONCURRENCY;
    }

    public Duration getSeriesDelay() {
        return seriesDelay != null ? seriesDelay : MwbotDefaults.SERIES_DELAY;
    }

    public int getContinuedQueryLimit() {
        return continuedQueryLimit != null ? continuedQueryLimit : MwbotDefaults.CONTINUED_QUERY_LIMIT;
    }

    @Override
    public String toString() {
        return String.format("[apiUrl=%s, username=%s, silent=%b, hasApiHighLimit=%b, maxlagPause=%s, maxlagMaxRetries=%d]",
            apiUrl, username, isSilent(), hasApiHighLimit(), getMaxlagPause(), getMaxlagMaxRetries());
    }

    public static final class Builder {
        private URI apiUrl;
        private String username;
        private String password;
        private String userAgent;
        private Boolean silent;
        private Boolean hasApiHighLimit;
        private Duration maxlagPause;
        private Integer maxlagMaxRetries;
        private Integer badtokenMaxRetries;
        private Integer batchConcurrency;
        private Duration seriesDelay;
        private Integer continuedQueryLimit;

        private Builder() {}

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = URI.create(apiUrl);
            return this;
        }

        public Builder apiUrl(URI apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = Objects.requireNonNull(username);
            this.password = Objects.requireNonNull(password);
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder hasApiHighLimit(boolean hasApiHighLimit) {
            this.hasApiHighLimit = hasApiHighLimit;
            return this;
        }

        public Builder maxlagPause(Duration maxlagPause) {
            this.maxlagPause = maxlagPause;
            return this;
        }

        public Builder maxlagMaxRetries(int maxlagMaxRetries) {
            this.maxlagMaxRetries = maxlagMaxRetries;
            return this;
        }

        public Builder badtokenMaxRetries(int badtokenMaxRetries) {
            this.badtokenMaxRetries = badtokenMaxRetries;
            return this;
        }

        public Builder batchConcurrency(int batchConcurrency) {
            this.batchConcurrency = batchConcurrency;
            return this;
        }

        public Builder seriesDelay(Duration seriesDelay) {
            this.seriesDelay = seriesDelay;
            return this;
        }

        public Builder continuedQueryLimit(int continuedQueryLimit) {
            this.continuedQueryLimit = continuedQueryLimit;
            return this;
        }

        public MwbotOptions build() {
            return new MwbotOptions(this);
        }
    }
}
