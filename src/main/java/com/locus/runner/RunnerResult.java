package com.locus.runner;

/**
 * Outcome of one agent CLI execution.
 *
 * @param success  true when the process exited 0 and was not aborted
 * @param output   accumulated textual output
 * @param error    error description, null on success
 * @param exitCode process exit code
 */
public record RunnerResult(boolean success, String output, String error, int exitCode) {

    public static final String ABORTED = "Aborted by user";

    public static RunnerResult success(String output) {
        return new RunnerResult(true, output, null, 0);
    }

    public static RunnerResult failure(String output, String error, int exitCode) {
        return new RunnerResult(false, output, error, exitCode);
    }

    public boolean aborted() {
        return ABORTED.equals(error);
    }
}
