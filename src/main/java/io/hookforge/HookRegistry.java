package io.hookforge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, ordered collection of {@link Hook}s.
 *
 * <p>Insertion order only decides the order in which a run plans its tasks; all hooks are
 * started and stopped concurrently. Registration is thread-safe, and a run works on the
 * snapshot taken when it begins.
 */
public final class HookRegistry {

    private final List<Hook> hooks;

    public HookRegistry() {
        this.hooks = new CopyOnWriteArrayList<Hook>();
    }

    /**
     * Appends a hook with any combination of present/absent callbacks.
     */
    public HookRegistry register(Hook hook) {
        Objects.requireNonNull(hook, "hook");
        hooks.add(hook);
        return this;
    }

    /**
     * Appends a hook that delegates to {@code lifecycle.start} and {@code lifecycle.stop}.
     */
    public HookRegistry register(Lifecycle lifecycle) {
        return register(Hook.from(lifecycle));
    }

    /**
     * @return an immutable snapshot in insertion order.
     */
    public List<Hook> hooks() {
        return Collections.unmodifiableList(new ArrayList<Hook>(hooks));
    }

    public int size() {
        return hooks.size();
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }
}
