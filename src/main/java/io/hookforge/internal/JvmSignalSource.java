package io.hookforge.internal;

import io.hookforge.SignalKind;
import io.hookforge.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SignalSource} backed by process signal handlers.
 *
 * <p>Handlers are process-wide: while a subscription is open it replaces the previous handler
 * of each observed signal, and closing it puts the previous handler back. Signals the VM
 * reserves for itself (QUIT on HotSpot, unless run with {@code -Xrs}) cannot be observed
 * and are skipped with a warning.
 */
public final class JvmSignalSource implements SignalSource {

    public static final JvmSignalSource INSTANCE = new JvmSignalSource();

    private static final Logger log = LoggerFactory.getLogger(JvmSignalSource.class);

    private JvmSignalSource() {
    }

    @Override
    public Subscription subscribe(Set<SignalKind> kinds, final Listener listener) {
        Objects.requireNonNull(kinds, "kinds");
        Objects.requireNonNull(listener, "listener");

        final Map<SignalKind, Object> previous = new EnumMap<SignalKind, Object>(SignalKind.class);
        if (!kinds.isEmpty() && !SignalBridge.isAvailable()) {
            log.warn("Process signal API not available; not observing {}", kinds);
        } else {
            for (final SignalKind kind : kinds) {
                try {
                    Object replaced = SignalBridge.install(kind.signalName(), new SignalBridge.Callback() {
                        @Override
                        public void handle(String signalName) {
                            listener.onSignal(kind);
                        }
                    });
                    previous.put(kind, replaced);
                } catch (IllegalArgumentException e) {
                    log.warn("Signal SIG{} cannot be observed: {}", kind.signalName(), e.getMessage());
                } catch (UnsupportedOperationException e) {
                    log.warn("Signal SIG{} cannot be observed: {}", kind.signalName(), e.getMessage());
                }
            }
        }

        final Set<SignalKind> observed = previous.isEmpty()
            ? Collections.<SignalKind>emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(previous.keySet()));
        log.debug("Observing signals {}", observed);
        return new JvmSubscription(observed, previous);
    }

    private static final class JvmSubscription implements Subscription {

        private final Set<SignalKind> kinds;
        private final Map<SignalKind, Object> previous;
        private final AtomicBoolean closed;

        private JvmSubscription(Set<SignalKind> kinds, Map<SignalKind, Object> previous) {
            this.kinds = kinds;
            this.previous = previous;
            this.closed = new AtomicBoolean(false);
        }

        @Override
        public Set<SignalKind> kinds() {
            return kinds;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            for (Map.Entry<SignalKind, Object> entry : previous.entrySet()) {
                try {
                    SignalBridge.restore(entry.getKey().signalName(), entry.getValue());
                } catch (RuntimeException e) {
                    log.warn("Failed to restore previous handler for SIG{}", entry.getKey().signalName(), e);
                }
            }
        }
    }
}
