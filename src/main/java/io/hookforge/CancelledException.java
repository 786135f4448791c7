package io.hookforge;

/**
 * Raised when a context is cancelled, either by a stop request or by a failing task.
 */
public class CancelledException extends RuntimeException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
