package com.locus.agent;

import com.locus.core.model.Task;
import com.locus.core.model.TaskResult;
import com.locus.runner.ProcessRunner;
import com.locus.runner.RunnerListener;
import com.locus.runner.RunnerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Runs the agent CLI for one task and condenses the run into a {@link TaskResult}.
 * Never throws.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final int MAX_SUMMARY_LENGTH = 2000;
    static final String DEFAULT_SUMMARY = "Task completed";

    private final String model;
    private final RunnerListener listener;

    public TaskExecutor(String model, RunnerListener listener) {
        this.model = model;
        this.listener = listener;
    }

    public TaskResult execute(Task task, ProcessRunner runner, Path cwd) {
        try {
            String prompt = PromptBuilder.build(task, cwd);
            String activity = "task %s: %s".formatted(task.id(), task.title());
            var result = runner.execute(new RunnerOptions(prompt, cwd, model, activity, listener));
            if (!result.success()) {
                String error = result.error() == null ? "Agent run failed" : result.error();
                log.warn("Agent run for task {} failed (exit {}): {}", task.id(), result.exitCode(), error);
                return TaskResult.failure(error);
            }
            return TaskResult.success(summarize(result.output()));
        } catch (RuntimeException e) {
            log.error("Execution of task {} failed", task.id(), e);
            return TaskResult.failure("Execution error: " + e.getMessage());
        }
    }

    static String summarize(String output) {
        if (output == null) {
            return DEFAULT_SUMMARY;
        }
        String summary = output.replace(PromptBuilder.COMPLETION_MARKER, "").trim();
        if (summary.isEmpty()) {
            return DEFAULT_SUMMARY;
        }
        return summary.length() > MAX_SUMMARY_LENGTH ? summary.substring(0, MAX_SUMMARY_LENGTH) : summary;
    }
}
