package com.ttennebkram.heightmap.error;

/**
 * Raised when a filter parameter, output size or settings document is invalid.
 * Always thrown before any pixel is processed.
 */
public class ConfigurationException extends HeightMapException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
