package com.hirepanel.core.persona;

/**
 * Thrown when persona configuration is unreadable or inconsistent.
 * Always raised before any backend call is made.
 */
public class PersonaConfigurationException extends RuntimeException {

    public PersonaConfigurationException(String message) {
        super(message);
    }

    public PersonaConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
