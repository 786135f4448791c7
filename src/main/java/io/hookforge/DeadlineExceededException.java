package io.hookforge;

/**
 * Raised when a callback's context passes its start or stop deadline.
 */
public class DeadlineExceededException extends CancelledException {

    public DeadlineExceededException(String message) {
        super(message);
    }
}
