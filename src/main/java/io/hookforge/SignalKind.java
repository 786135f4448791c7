package io.hookforge;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * OS-level notifications a run can listen for.
 */
public enum SignalKind {
    INT("INT"),
    QUIT("QUIT"),
    TERM("TERM"),
    HUP("HUP"),
    USR1("USR1"),
    USR2("USR2");

    private static final Set<SignalKind> TERMINATION = Collections.unmodifiableSet(EnumSet.of(INT, QUIT, TERM));

    private final String signalName;

    SignalKind(String signalName) {
        this.signalName = signalName;
    }

    /**
     * @return the name the JDK uses for this signal, without the {@code SIG} prefix.
     */
    public String signalName() {
        return signalName;
    }

    public boolean isTermination() {
        return TERMINATION.contains(this);
    }

    /**
     * @return INT, QUIT and TERM.
     */
    public static Set<SignalKind> termination() {
        return TERMINATION;
    }

    /**
     * @return the kind named {@code name} (with or without {@code SIG} prefix), or {@code null}.
     */
    public static SignalKind fromSignalName(String name) {
        if (name == null) {
            return null;
        }
        String bare = name.startsWith("SIG") ? name.substring(3) : name;
        for (SignalKind kind : values()) {
            if (kind.signalName.equals(bare)) {
                return kind;
            }
        }
        return null;
    }
}
