package com.github.mwbot.main;

/**
 * The session options do not match what the remote account is allowed to do.
 */
public class MwbotConfigurationException extends IllegalStateException {
    private static final long serialVersionUID = 7151962364118846671L;

    public MwbotConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
