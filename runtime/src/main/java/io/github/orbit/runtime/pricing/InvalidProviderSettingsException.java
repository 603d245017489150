package io.github.orbit.runtime.pricing;

public class InvalidProviderSettingsException extends RuntimeException {

    public InvalidProviderSettingsException(String message) {
        super(message);
    }
}
