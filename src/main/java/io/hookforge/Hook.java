package io.hookforge;

import java.util.Objects;

/**
 * A registered pair of optional start/stop callbacks representing one managed component.
 *
 * <p>A missing callback spawns no task when the hook is run.
 */
public final class Hook {

    private final String name;
    private final HookCallback onStart;
    private final HookCallback onStop;

    private Hook(String name, HookCallback onStart, HookCallback onStop) {
        this.name = name;
        this.onStart = onStart;
        this.onStop = onStop;
    }

    /**
     * Either callback may be {@code null}.
     */
    public static Hook of(HookCallback onStart, HookCallback onStop) {
        return new Hook(null, onStart, onStop);
    }

    public static Hook onStart(HookCallback onStart) {
        Objects.requireNonNull(onStart, "onStart");
        return new Hook(null, onStart, null);
    }

    public static Hook onStop(HookCallback onStop) {
        Objects.requireNonNull(onStop, "onStop");
        return new Hook(null, null, onStop);
    }

    /**
     * Wraps a {@link Lifecycle} component; the hook is named after the component's class.
     */
    public static Hook from(final Lifecycle lifecycle) {
        Objects.requireNonNull(lifecycle, "lifecycle");
        String simpleName = lifecycle.getClass().getSimpleName();
        return new Hook(simpleName.isEmpty() ? null : simpleName, new HookCallback() {
            @Override
            public void call(HookContext ctx) throws Exception {
                lifecycle.start(ctx);
            }
        }, new HookCallback() {
            @Override
            public void call(HookContext ctx) throws Exception {
                lifecycle.stop(ctx);
            }
        });
    }

    /**
     * Returns a copy carrying a display name used in task names and error messages.
     */
    public Hook named(String name) {
        Objects.requireNonNull(name, "name");
        return new Hook(name, onStart, onStop);
    }

    /**
     * @return the display name, or {@code null} when unnamed.
     */
    public String name() {
        return name;
    }

    public HookCallback onStart() {
        return onStart;
    }

    public HookCallback onStop() {
        return onStop;
    }

    public boolean hasStart() {
        return onStart != null;
    }

    public boolean hasStop() {
        return onStop != null;
    }
}
