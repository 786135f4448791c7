package io.hookforge;

import java.time.Duration;

/**
 * Context handed to every start/stop callback.
 *
 * <p>It carries a deadline and a cooperative cancellation signal. Each callback invocation
 * gets its own context; one hook running out of time never shortens another hook's deadline.
 * Implementations are thread-safe.
 */
public interface HookContext {

    /**
     * @return true once the context was cancelled or its deadline passed.
     */
    boolean isCancelled();

    /**
     * @return the cancellation cause, or {@code null} while the context is active.
     * A passed deadline yields a {@link DeadlineExceededException}.
     */
    CancelledException cause();

    /**
     * Throws {@link #cause()} if the context is no longer active.
     */
    void throwIfCancelled();

    boolean hasDeadline();

    /**
     * @return time left until the deadline, {@link Duration#ZERO} once it passed,
     * or {@code null} for a context without deadline.
     */
    Duration remaining();

    /**
     * Blocks until the context is cancelled.
     */
    void awaitCancellation() throws InterruptedException;

    /**
     * Blocks until the context is cancelled or the timeout elapses.
     *
     * @return true if the context was cancelled
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException;

    ServiceInfo serviceInfo();
}
