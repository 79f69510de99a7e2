package com.locus.git;

import com.locus.core.model.Task;

import java.nio.file.Path;

/**
 * Input for a single-task pull request.
 *
 * @param task       the task the branch implements
 * @param branch     pushed head branch
 * @param baseBranch branch the PR targets
 * @param summary    agent execution summary
 * @param agentId    worker identity, shown in the PR footer
 * @param workDir    checkout to run git/gh in
 */
public record PrRequest(Task task, String branch, String baseBranch, String summary, String agentId, Path workDir) {}
