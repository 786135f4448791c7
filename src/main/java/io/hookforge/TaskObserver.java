package io.hookforge;

import java.time.Duration;

/**
 * Observability callbacks for the tasks of a run.
 * Implementations should avoid blocking the worker thread for long periods.
 *
 * <p>Failures thrown by an observer are logged and never affect the run.
 */
public interface TaskObserver {

    TaskObserver NOOP = new TaskObserver() {
    };

    default void onStart(TaskInfo info) {
    }

    default void onSuccess(TaskInfo info, Duration duration) {
    }

    default void onFailure(TaskInfo info, Throwable error, Duration duration) {
    }
}
