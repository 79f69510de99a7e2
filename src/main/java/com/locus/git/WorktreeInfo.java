package com.locus.git;

import java.nio.file.Path;

/**
 * One entry of {@code git worktree list --porcelain}.
 *
 * @param path     worktree directory
 * @param head     checked-out commit
 * @param branch   short branch name, or null when detached
 * @param isMain   true for the repository's main working tree
 * @param prunable true when git reports the worktree directory as gone
 */
public record WorktreeInfo(Path path, String head, String branch, boolean isMain, boolean prunable) {}
