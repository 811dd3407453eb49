package com.github.mwbot.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.security.auth.login.CredentialException;
import javax.security.auth.login.FailedLoginException;
import javax.security.auth.login.LoginException;

import com.github.mwbot.main.Mwbot;
import com.github.mwbot.main.MwbotOptions;

public class Login {
    private static final Path LOCATION = Paths.get("./data/sessions/");
    private static final String LOGIN_FORMAT = "%s@%s";
    private static final String USER_AGENT_FILENAME = "useragent.txt";
    private static final String BOT_PASSWORD_SUFFIX = "mwbot";
    private static final String ENV_USERNAME_VAR = "MWBOT_MAIN_ACCOUNT";

    private static final Logger LOGGER = Logger.getLogger("mwbot.login");

    private Login() {}

    public static Mwbot createSession(String apiUrl) throws LoginException {
        return createSession(apiUrl, System.getenv(ENV_USERNAME_VAR));
    }

    public static Mwbot createSession(String apiUrl, String username) throws LoginException {
        var mwb = Mwbot.newSession(apiUrl);
        login(mwb, username, LOCATION);
        return mwb;
    }

    /**
     * Logs in with the bot password stored at {@code <location>/<username>@mwbot.txt}
     * and appends the contents of {@code useragent.txt} to the user agent, if present.
     * Blocks until the login completes.
     *
     * @throws LoginException the credentials could not be read or were rejected
     */
    public static void login(Mwbot mwb, String username, Path location) throws LoginException {
        Objects.requireNonNull(mwb);

        if (username == null) {
            throw new CredentialException("No username given, set the " + ENV_USERNAME_VAR + " variable");
        }

        final String password;

        try {
            password = retrieveCredentials(username, location);
        } catch (IOException e) {
            throw new CredentialException("Unable to retrieve credentials: " + e.getMessage());
        }

        var userAgent = readUserAgent(username, location);
        mwb.setUserAgent(String.format("%s, %s", mwb.getOptions().getUserAgent(), userAgent));

        var fullUsername = String.format(LOGIN_FORMAT, username, BOT_PASSWORD_SUFFIX);
        mwb.setOptions(MwbotOptions.builder().credentials(fullUsername, password).build());

        try {
            mwb.login().join();
        } catch (CompletionException e) {
            var ex = new FailedLoginException(e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            ex.initCause(e.getCause());
            throw ex;
        }

        LOGGER.logp(Level.INFO, "Login", "login", String.format("Logged in as %s at %s",
            mwb.getSession().get("lgusername"), mwb.getOptions().getApiUrl()));
    }

    private static String retrieveCredentials(String username, Path location) throws IOException {
        var filename = String.format(LOGIN_FORMAT, username, BOT_PASSWORD_SUFFIX) + ".txt";
        LOGGER.logp(Level.FINE, "Login", "retrieveCredentials", "Reading from: " + filename);
        return Files.readString(location.resolve(filename)).trim();
    }

    private static String readUserAgent(String username, Path location) {
        try {
            return Files.readAllLines(location.resolve(USER_AGENT_FILENAME)).get(0);
        } catch (IOException | IndexOutOfBoundsException e) {
            LOGGER.logp(Level.WARNING, "Login", "readUserAgent",
                "Setting basic user agent, please edit " + USER_AGENT_FILENAME, e);
            return "bot operator: User:" + username;
        }
    }
}
