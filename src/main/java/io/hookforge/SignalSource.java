package io.hookforge;

import java.util.Set;

/**
 * Delivers process signals to a run.
 *
 * <p>A subscription lives exactly as long as the signal listener of one run; closing it
 * restores whatever process state the subscription changed.
 */
public interface SignalSource {

    /**
     * Starts delivering the given kinds to {@code listener}.
     * Kinds the source cannot observe are left out of {@link Subscription#kinds()}.
     */
    Subscription subscribe(Set<SignalKind> kinds, Listener listener);

    interface Listener {

        void onSignal(SignalKind signal);
    }

    interface Subscription extends AutoCloseable {

        /**
         * @return the kinds actually being observed.
         */
        Set<SignalKind> kinds();

        /**
         * Stops delivery. Idempotent.
         */
        @Override
        void close();
    }
}
