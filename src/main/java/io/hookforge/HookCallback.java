package io.hookforge;

/**
 * One side of a {@link Hook}: a start or a stop action.
 *
 * <p>Implementations should honour {@link HookContext#isCancelled()} and the context deadline;
 * the runner never interrupts a callback that overruns its timeout.
 */
public interface HookCallback {

    void call(HookContext ctx) throws Exception;
}
