package io.hookforge;

/**
 * A component that can be started and stopped.
 */
public interface Lifecycle {

    void start(HookContext ctx) throws Exception;

    void stop(HookContext ctx) throws Exception;
}
