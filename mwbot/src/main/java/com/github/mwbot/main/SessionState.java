package com.github.mwbot.main;

import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONObject;

import com.github.mwbot.utils.MwbotDefaults;

/**
 * Mutable per-session state: the current CSRF token, the login record returned by the
 * server (token and identity fields) and the logged-in flag.
 */
public final class SessionState {
    private volatile String csrfToken = MwbotDefaults.NO_TOKEN;
    private volatile boolean loggedIn;
    private final Map<String, Object> state = new LinkedHashMap<>();

    public String getCsrfToken() {
        return csrfToken;
    }

    void setCsrfToken(String csrfToken) {
        this.csrfToken = csrfToken;
    }

    public boolean isLoggedIn() {
        return loggedIn;
    }

    void setLoggedIn(boolean loggedIn) {
        this.loggedIn = loggedIn;
    }

    synchronized void mergeState(JSONObject fields) {
        for (var key : fields.keySet()) {
            state.put(key, fields.get(key));
        }
    }

    public synchronized Map<String, Object> getState() {
        return Map.copyOf(state);
    }

    public synchronized Object get(String key) {
        return state.get(key);
    }
}
