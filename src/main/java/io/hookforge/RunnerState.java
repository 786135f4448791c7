package io.hookforge;

/**
 * Lifecycle phases of a {@link LifecycleRunner}.
 */
public enum RunnerState {
    /** Never run. */
    IDLE,
    /** Tasks spawned, waiting for a shutdown trigger. */
    RUNNING,
    /** Triggered; stop tasks are draining. */
    SHUTTING_DOWN,
    /** Every task of the last run has returned. */
    TERMINATED;

    /**
     * @return true while a run owns a live root context.
     */
    public boolean isActive() {
        return this == RUNNING || this == SHUTTING_DOWN;
    }
}
