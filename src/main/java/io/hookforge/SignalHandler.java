package io.hookforge;

/**
 * Maps a received signal to an action on the run.
 *
 * <p>Invoked on the signal listener task. An exception thrown here fails that task and
 * therefore triggers shutdown.
 */
public interface SignalHandler {

    void onSignal(RunnerHandle handle, SignalKind signal);

    /**
     * Requests stop for INT, QUIT and TERM; ignores every other kind.
     */
    static SignalHandler stopOnTermination() {
        return DefaultSignalHandler.INSTANCE;
    }

    final class DefaultSignalHandler implements SignalHandler {

        private static final DefaultSignalHandler INSTANCE = new DefaultSignalHandler();

        private DefaultSignalHandler() {
        }

        @Override
        public void onSignal(RunnerHandle handle, SignalKind signal) {
            if (signal.isTermination()) {
                handle.requestStop();
            }
        }
    }
}
