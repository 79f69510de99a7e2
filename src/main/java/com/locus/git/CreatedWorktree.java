package com.locus.git;

import java.nio.file.Path;

/**
 * A freshly created task worktree.
 *
 * @param path           worktree directory
 * @param branch         dedicated task branch
 * @param baseBranch     branch the task branch was created from
 * @param baseCommitHash commit the task branch started at
 */
public record CreatedWorktree(Path path, String branch, String baseBranch, String baseCommitHash) {}
