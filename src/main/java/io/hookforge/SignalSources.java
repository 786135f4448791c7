package io.hookforge;

import io.hookforge.internal.JvmSignalSource;
import io.hookforge.internal.ShutdownHookSignalSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Factories for {@link SignalSource}s.
 */
public final class SignalSources {

    private SignalSources() {
    }

    /**
     * Process signal handlers installed through the JDK signal API.
     */
    public static SignalSource jvm() {
        return JvmSignalSource.INSTANCE;
    }

    /**
     * Reports {@link SignalKind#TERM} when the JVM starts its shutdown sequence and holds
     * the shutdown until the subscription is closed, so the run can stop its hooks first.
     */
    public static SignalSource shutdownHook() {
        return new ShutdownHookSignalSource();
    }

    /**
     * Subscribes to every source; a kind counts as observed when any source observes it.
     */
    public static SignalSource composite(SignalSource first, SignalSource... rest) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(rest, "rest");
        final List<SignalSource> sources = new ArrayList<SignalSource>(rest.length + 1);
        sources.add(first);
        sources.addAll(Arrays.asList(rest));
        return new SignalSource() {
            @Override
            public Subscription subscribe(Set<SignalKind> kinds, Listener listener) {
                final List<Subscription> subscriptions = new ArrayList<Subscription>(sources.size());
                final Set<SignalKind> observed = EnumSet.noneOf(SignalKind.class);
                for (SignalSource source : sources) {
                    Subscription subscription;
                    try {
                        subscription = source.subscribe(kinds, listener);
                    } catch (RuntimeException e) {
                        for (Subscription opened : subscriptions) {
                            opened.close();
                        }
                        throw e;
                    }
                    subscriptions.add(subscription);
                    observed.addAll(subscription.kinds());
                }
                final Set<SignalKind> observedView = Collections.unmodifiableSet(observed);
                return new Subscription() {
                    @Override
                    public Set<SignalKind> kinds() {
                        return observedView;
                    }

                    @Override
                    public void close() {
                        RuntimeException primary = null;
                        for (Subscription subscription : subscriptions) {
                            try {
                                subscription.close();
                            } catch (RuntimeException e) {
                                if (primary == null) {
                                    primary = e;
                                } else {
                                    primary.addSuppressed(e);
                                }
                            }
                        }
                        if (primary != null) {
                            throw primary;
                        }
                    }
                };
            }
        };
    }
}
