package io.hookforge.internal;

import io.hookforge.CancelledException;
import io.hookforge.DeadlineExceededException;
import io.hookforge.DelayScheduler;
import io.hookforge.HookContext;
import io.hookforge.ScheduledTask;
import io.hookforge.ServiceInfo;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cancellable {@link HookContext}, optionally bounded by a deadline.
 *
 * <p>The first {@link #cancel(CancelledException)} wins; later calls are no-ops. A passed
 * deadline is observed both by a timer on the {@link DelayScheduler} and on every query, so
 * callers never see an expired context reported as active.
 */
public final class CancellableContext implements HookContext {

    private static final long NO_DEADLINE = Long.MIN_VALUE;

    private final AtomicReference<CancelledException> cause;
    private final CountDownLatch cancelled;
    private final List<Runnable> listeners;
    private final ServiceInfo serviceInfo;
    private final long deadlineAtNanos;
    private final Duration timeout;
    private volatile ScheduledTask deadlineTimer;

    private CancellableContext(ServiceInfo serviceInfo, Duration timeout) {
        this.cause = new AtomicReference<CancelledException>();
        this.cancelled = new CountDownLatch(1);
        this.listeners = new CopyOnWriteArrayList<Runnable>();
        this.serviceInfo = Objects.requireNonNull(serviceInfo, "serviceInfo");
        this.timeout = timeout;
        this.deadlineAtNanos = timeout == null ? NO_DEADLINE : System.nanoTime() + timeout.toNanos();
    }

    /**
     * Creates a context without deadline; it ends only through {@link #cancel(CancelledException)}.
     */
    public static CancellableContext root(ServiceInfo serviceInfo) {
        return new CancellableContext(serviceInfo, null);
    }

    /**
     * Creates a context that cancels itself with {@link DeadlineExceededException} once
     * {@code timeout} elapses.
     */
    public static CancellableContext withTimeout(ServiceInfo serviceInfo, Duration timeout, DelayScheduler delayScheduler) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(delayScheduler, "delayScheduler");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        final CancellableContext context = new CancellableContext(serviceInfo, timeout);
        context.deadlineTimer = delayScheduler.schedule(timeout, new Runnable() {
            @Override
            public void run() {
                context.expire();
            }
        });
        return context;
    }

    /**
     * Cancels the context with the given cause.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel(CancelledException reason) {
        Objects.requireNonNull(reason, "reason");
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        ScheduledTask timer = deadlineTimer;
        if (timer != null) {
            timer.cancel();
        }
        cancelled.countDown();
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    /**
     * Registers an action run once on cancellation, on the cancelling thread.
     * Runs immediately when the context is already cancelled.
     */
    public void onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * Ends the context once its callback returned.
     */
    public void release() {
        cancel(new CancelledException("context canceled"));
    }

    @Override
    public boolean isCancelled() {
        return cause() != null;
    }

    @Override
    public CancelledException cause() {
        CancelledException current = cause.get();
        if (current == null && deadlinePassed()) {
            expire();
            current = cause.get();
        }
        return current;
    }

    @Override
    public void throwIfCancelled() {
        CancelledException current = cause();
        if (current != null) {
            throw current;
        }
    }

    @Override
    public boolean hasDeadline() {
        return deadlineAtNanos != NO_DEADLINE;
    }

    @Override
    public Duration remaining() {
        if (!hasDeadline()) {
            return null;
        }
        long remainingNanos = deadlineAtNanos - System.nanoTime();
        return remainingNanos <= 0L ? Duration.ZERO : Duration.ofNanos(remainingNanos);
    }

    @Override
    public void awaitCancellation() throws InterruptedException {
        while (!isCancelled()) {
            Duration remaining = remaining();
            if (remaining == null) {
                cancelled.await();
            } else {
                cancelled.await(Math.max(1L, remaining.toNanos()), TimeUnit.NANOSECONDS);
            }
        }
    }

    @Override
    public boolean awaitCancellation(Duration waitFor) throws InterruptedException {
        Objects.requireNonNull(waitFor, "waitFor");
        long limitNanos = System.nanoTime() + waitFor.toNanos();
        while (!isCancelled()) {
            long waitNanos = limitNanos - System.nanoTime();
            if (waitNanos <= 0L) {
                return false;
            }
            Duration remaining = remaining();
            if (remaining != null) {
                waitNanos = Math.min(waitNanos, Math.max(1L, remaining.toNanos()));
            }
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        }
        return true;
    }

    @Override
    public ServiceInfo serviceInfo() {
        return serviceInfo;
    }

    private boolean deadlinePassed() {
        return hasDeadline() && System.nanoTime() - deadlineAtNanos >= 0L;
    }

    private void expire() {
        cancel(new DeadlineExceededException("context deadline exceeded after " + timeout.toMillis() + " ms"));
    }
}
