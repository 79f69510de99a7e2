package com.locus.sandbox;

import java.util.Locale;

/**
 * How the lifetime of a sandbox is owned.
 */
public enum SandboxMode {
    /** No sandbox; the agent CLI runs directly on the host. */
    NONE,
    /** One sandbox per execution, destroyed when the execution ends. */
    EPHEMERAL,
    /** Created on first use and reused until explicitly destroyed. */
    PERSISTENT,
    /** Created and destroyed by the user; the worker only execs into it. */
    USER_MANAGED;

    public boolean ownsLifecycle() {
        return this == EPHEMERAL || this == PERSISTENT;
    }

    public static SandboxMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
