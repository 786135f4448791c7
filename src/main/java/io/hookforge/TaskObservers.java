package io.hookforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

final class TaskObservers {

    private static final Logger log = LoggerFactory.getLogger(TaskObservers.class);

    private TaskObservers() {
    }

    static TaskObserver compose(final TaskObserver left, final TaskObserver right) {
        if (left == TaskObserver.NOOP) {
            return right;
        }
        if (right == TaskObserver.NOOP) {
            return left;
        }
        return new TaskObserver() {
            @Override
            public void onStart(TaskInfo info) {
                safeStart(left, info);
                safeStart(right, info);
            }

            @Override
            public void onSuccess(TaskInfo info, Duration duration) {
                safeSuccess(left, info, duration);
                safeSuccess(right, info, duration);
            }

            @Override
            public void onFailure(TaskInfo info, Throwable error, Duration duration) {
                safeFailure(left, info, error, duration);
                safeFailure(right, info, error, duration);
            }
        };
    }

    static void safeStart(TaskObserver observer, TaskInfo info) {
        try {
            observer.onStart(info);
        } catch (Throwable t) {
            log.warn("Task observer failed in onStart for {}", info, t);
        }
    }

    static void safeSuccess(TaskObserver observer, TaskInfo info, Duration duration) {
        try {
            observer.onSuccess(info, duration);
        } catch (Throwable t) {
            log.warn("Task observer failed in onSuccess for {}", info, t);
        }
    }

    static void safeFailure(TaskObserver observer, TaskInfo info, Throwable error, Duration duration) {
        try {
            observer.onFailure(info, error, duration);
        } catch (Throwable t) {
            log.warn("Task observer failed in onFailure for {}", info, t);
        }
    }
}
