package com.locus.core.model;

/**
 * Outcome of processing one task.
 *
 * @param success   whether the agent run succeeded
 * @param summary   human-readable summary, also used in task comments
 * @param branch    branch holding the committed work, or null
 * @param prUrl     pull request URL, or null
 * @param prError   why PR automation did not produce a PR, or null
 * @param noChanges true when the agent ran successfully but wrote nothing
 */
public record TaskResult(
    boolean success,
    String summary,
    String branch,
    String prUrl,
    String prError,
    boolean noChanges
) {

    public static TaskResult success(String summary) {
        return new TaskResult(true, summary, null, null, null, false);
    }

    public static TaskResult failure(String summary) {
        return new TaskResult(false, summary, null, null, null, false);
    }

    public TaskResult withIntegration(String branch, String prUrl, String prError, boolean noChanges) {
        return new TaskResult(success, summary, branch, prUrl, prError, noChanges);
    }
}
