package com.anodi.server.ai;

/**
 * Raised when evaluation settings cannot be applied: patch size out of range
 * or larger than an image, or an unusable list of resolution factors.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
