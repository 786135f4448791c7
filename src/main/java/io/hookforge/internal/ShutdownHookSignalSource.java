package io.hookforge.internal;

import io.hookforge.SignalKind;
import io.hookforge.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SignalSource} that turns the start of JVM shutdown into {@link SignalKind#TERM}.
 *
 * <p>The shutdown hook reports TERM and then blocks until the subscription is closed, which
 * happens when the signal listener of the run exits. The VM therefore halts only after the
 * run's stop callbacks have had their chance to finish.
 */
public final class ShutdownHookSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHookSignalSource.class);

    @Override
    public Subscription subscribe(Set<SignalKind> kinds, final Listener listener) {
        Objects.requireNonNull(kinds, "kinds");
        Objects.requireNonNull(listener, "listener");
        if (!kinds.contains(SignalKind.TERM)) {
            return new HookSubscription(null, new CountDownLatch(0));
        }

        CountDownLatch released = new CountDownLatch(1);
        Thread hook = new Thread(new HoldUntilReleased(listener, released), "hookforge-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return new HookSubscription(hook, released);
    }

    /**
     * Body of the shutdown hook: reports TERM, then holds the VM until released.
     */
    static final class HoldUntilReleased implements Runnable {

        private final Listener listener;
        private final CountDownLatch released;

        HoldUntilReleased(Listener listener, CountDownLatch released) {
            this.listener = listener;
            this.released = released;
        }

        @Override
        public void run() {
            log.info("JVM shutdown started; stopping run");
            listener.onSignal(SignalKind.TERM);
            try {
                released.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    static final class HookSubscription implements Subscription {

        private final Thread hook;
        private final CountDownLatch released;
        private final AtomicBoolean closed;

        private HookSubscription(Thread hook, CountDownLatch released) {
            this.hook = hook;
            this.released = released;
            this.closed = new AtomicBoolean(false);
        }

        /**
         * @return the registered hook thread, or {@code null} when TERM was not requested.
         */
        Thread hookThread() {
            return hook;
        }

        @Override
        public Set<SignalKind> kinds() {
            return hook == null ? Collections.<SignalKind>emptySet() : Collections.unmodifiableSet(EnumSet.of(SignalKind.TERM));
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true) || hook == null) {
                return;
            }
            released.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // shutdown already in progress; the hook is running and was just released
                log.debug("Shutdown in progress, leaving hook {} in place", hook.getName());
            }
        }
    }
}
