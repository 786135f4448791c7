package io.hookforge;

/**
 * Raised when a start or stop callback fails with a checked exception.
 */
public class LifecycleException extends RuntimeException {

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
