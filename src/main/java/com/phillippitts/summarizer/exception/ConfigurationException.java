package com.phillippitts.summarizer.exception;

/**
 * Thrown when backend parameters are missing or invalid (unknown provider, blank model path,
 * unknown asset id). Surfaced immediately and never retried internally.
 */
public class ConfigurationException extends SummarizerException {

    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
