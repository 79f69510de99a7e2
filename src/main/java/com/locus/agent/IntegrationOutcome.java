package com.locus.agent;

import com.locus.core.model.TaskResult;

/**
 * How a successful agent run ended up in version control.
 */
public enum IntegrationOutcome {
    /** The agent wrote nothing; the task is blocked. */
    NO_CHANGES,
    /** Work is committed and a pull request is open. */
    COMPLETED_WITH_PR,
    /** Work is done but no pull request exists (push disabled, failed, or shared checkout). */
    COMPLETED_NO_PR;

    public static IntegrationOutcome of(TaskResult result) {
        if (result.noChanges()) {
            return NO_CHANGES;
        }
        return result.prUrl() != null ? COMPLETED_WITH_PR : COMPLETED_NO_PR;
    }
}
