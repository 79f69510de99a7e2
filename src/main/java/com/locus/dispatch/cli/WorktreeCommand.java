package com.locus.dispatch.cli;

import com.locus.core.config.LocusProperties;
import com.locus.git.CommandException;
import com.locus.git.CommandExecutor;
import com.locus.git.WorktreeManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;

/**
 * CLI command: locus worktree list|prune|clean
 * <p>
 * Inspects and tidies the per-task worktrees workers leave under the project.
 */
@Command(name = "worktree", mixinStandardHelpOptions = true, description = "Inspect and clean up agent worktrees")
@Component
public class WorktreeCommand implements Runnable {

    @Option(names = "--project-path", defaultValue = ".", description = "Git checkout holding the worktrees")
    Path projectPath;

    @Spec
    CommandSpec spec;

    private final CommandExecutor executor;
    private final LocusProperties properties;

    public WorktreeCommand(CommandExecutor executor, LocusProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "list", description = "List agent worktrees")
    int list() {
        try {
            var worktrees = manager().listAgentWorktrees();
            if (worktrees.isEmpty()) {
                ConsoleOutput.info("No agent worktrees.");
                return 0;
            }
            System.out.println("AGENT WORKTREES:");
            for (var info : worktrees) {
                System.out.printf("  %-50s %s%s%n", info.path(), info.branch() != null ? info.branch() : "(detached)",
                        info.prunable() ? " [prunable]" : "");
            }
            return 0;
        } catch (CommandException e) {
            ConsoleOutput.error("Could not list worktrees: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "prune", description = "Drop metadata of worktrees whose directories are gone")
    int prune() {
        try {
            ConsoleOutput.success("Pruned " + manager().prune() + " stale worktree(s).");
            return 0;
        } catch (CommandException e) {
            ConsoleOutput.error("Prune failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "clean", description = "Remove every agent worktree (branches are kept)")
    int clean() {
        try {
            ConsoleOutput.success("Removed " + manager().removeAll() + " worktree(s).");
            return 0;
        } catch (CommandException e) {
            ConsoleOutput.error("Clean failed: " + e.getMessage());
            return 1;
        }
    }

    private WorktreeManager manager() {
        var git = properties.getGit();
        return new WorktreeManager(executor, projectPath, git.getRemote(), git.getBranchPrefix(),
                git.getBaseBranch(), git.getWorktreeRoot());
    }
}
