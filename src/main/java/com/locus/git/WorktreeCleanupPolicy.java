package com.locus.git;

import java.util.Locale;

/**
 * What happens to leftover managed worktrees when a worker run ends.
 */
public enum WorktreeCleanupPolicy {
    /** Keep preserved worktrees for manual recovery, prune only stale metadata. */
    RETAIN_ON_FAILURE,
    /** Remove every managed worktree. */
    AUTO,
    /** Leave everything untouched. */
    MANUAL;

    public static WorktreeCleanupPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return RETAIN_ON_FAILURE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
