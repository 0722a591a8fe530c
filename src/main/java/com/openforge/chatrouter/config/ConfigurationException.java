package com.openforge.chatrouter.config;

/**
 * Invalid or missing configuration detected at startup.  Fatal for the
 * application; never shown to chat users.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
