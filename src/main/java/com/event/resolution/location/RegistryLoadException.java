package com.event.resolution.location;

/**
 * Thrown when the location registry cannot be read or parsed.
 * Without the registry no venue can be resolved, so this aborts a processing run.
 */
public class RegistryLoadException extends RuntimeException {

    public RegistryLoadException(String message) {
        super(message);
    }

    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
