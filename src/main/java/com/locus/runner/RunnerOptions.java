package com.locus.runner;

import java.nio.file.Path;

/**
 * Input for a single {@link ProcessRunner#execute} call.
 *
 * @param prompt   prompt written to the CLI's standard input
 * @param cwd      working directory of the agent
 * @param model    model override, may be null
 * @param activity free-text label of what is being worked on (used for sandbox naming)
 * @param listener live event sink
 */
public record RunnerOptions(String prompt, Path cwd, String model, String activity, RunnerListener listener) {

    public RunnerOptions {
        listener = listener == null ? RunnerListener.NONE : listener;
    }

    public static RunnerOptions of(String prompt, Path cwd) {
        return new RunnerOptions(prompt, cwd, null, null, RunnerListener.NONE);
    }
}
