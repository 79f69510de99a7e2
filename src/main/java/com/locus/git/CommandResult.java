package com.locus.git;

/**
 * Captured result of a finished external command.
 *
 * @param exitCode process exit code, {@link #TIMED_OUT} when the command was killed on timeout
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public static final int TIMED_OUT = -2;

    public boolean ok() {
        return exitCode == 0;
    }

    /** Trimmed stdout. */
    public String out() {
        return stdout == null ? "" : stdout.trim();
    }

    /** stderr when present, otherwise stdout; used for error messages. */
    public String errorText() {
        var err = stderr == null ? "" : stderr.trim();
        return err.isEmpty() ? out() : err;
    }
}
