package io.hookforge;

/**
 * What a task spawned by a run is doing.
 */
public enum TaskKind {
    /** Invokes a hook's start callback. */
    START,
    /** Waits for shutdown, then invokes a hook's stop callback. */
    STOP,
    /** Listens for process signals. */
    SIGNAL
}
