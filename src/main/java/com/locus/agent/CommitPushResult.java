package com.locus.agent;

/**
 * Result of committing a task's changes and pushing its branch.
 *
 * @param branch     branch holding the commit, or null when nothing was committed
 * @param pushed     branch reached the remote
 * @param pushFailed a push was attempted and failed
 * @param pushError  push failure message, or null
 * @param skipReason why no PR will be opened, or null
 * @param noChanges  the agent produced no file changes
 */
public record CommitPushResult(
    String branch,
    boolean pushed,
    boolean pushFailed,
    String pushError,
    String skipReason,
    boolean noChanges
) {

    static final String NO_CHANGES_REASON = "No changes were committed, so no branch was pushed.";
    static final String AUTO_PUSH_DISABLED_REASON = "Auto-push is disabled, so PR creation was skipped.";

    public static CommitPushResult nothingToCommit() {
        return new CommitPushResult(null, false, false, null, NO_CHANGES_REASON, true);
    }

    public static CommitPushResult pushed(String branch) {
        return new CommitPushResult(branch, true, false, null, null, false);
    }

    public static CommitPushResult pushFailed(String branch, String error) {
        return new CommitPushResult(branch, false, true, error, null, false);
    }

    public static CommitPushResult committedOnly(String branch) {
        return new CommitPushResult(branch, false, false, null, AUTO_PUSH_DISABLED_REASON, false);
    }

    public static CommitPushResult commitFailed(String error) {
        return new CommitPushResult(null, false, false, null, error, false);
    }

    public boolean committed() {
        return branch != null;
    }

    /**
     * The agent changed files but they could not be committed.
     */
    public boolean failedToCommit() {
        return branch == null && !noChanges;
    }
}
