package com.elime.service;

/**
 * A configured folder or file does not exist or cannot be used. Commands stop
 * before touching anything.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String key;

    public InvalidConfigurationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
