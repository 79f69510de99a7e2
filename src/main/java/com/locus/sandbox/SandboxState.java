package com.locus.sandbox;

/**
 * Lifecycle state of one sandbox.
 *
 * <pre>
 * UNRESERVED ──create──▶ CREATED ──destroy──▶ DESTROYED
 *      ▲                    │
 *      └──liveness lost─────┘
 * </pre>
 */
public enum SandboxState {
    UNRESERVED,
    CREATED,
    DESTROYED;

    public boolean canTransitionTo(SandboxState next) {
        return switch (this) {
            case UNRESERVED -> next == CREATED || next == DESTROYED;
            case CREATED -> next == UNRESERVED || next == DESTROYED;
            case DESTROYED -> false;
        };
    }
}
