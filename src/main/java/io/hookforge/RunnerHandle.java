package io.hookforge;

/**
 * View of one {@link LifecycleRunner#run()} invocation, handed to {@link SignalHandler}s.
 */
public interface RunnerHandle {

    /**
     * Cancels the run this handle belongs to. Safe to call any number of times.
     */
    void requestStop();

    ServiceInfo serviceInfo();

    RunnerState state();
}
